package com.codeheadsystems.fido2.api.model;

import com.codeheadsystems.fido2.api.cbor.CtapCbor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * authenticatorGetInfo response: the static capabilities of this authenticator.
 *
 * @param versions                         supported protocol versions
 * @param aaguid                           the authenticator model
 * @param options                          supported option flags, in canonical key order
 * @param algorithms                       supported credential algorithms
 * @param remainingDiscoverableCredentials estimate of free discoverable credential slots
 */
public record GetInfoResponse(List<String> versions,
                              Aaguid aaguid,
                              Map<String, Boolean> options,
                              List<PublicKeyCredentialParameters> algorithms,
                              int remainingDiscoverableCredentials) {

  public GetInfoResponse {
    versions = List.copyOf(versions);
    options = options == null ? Map.of() : new LinkedHashMap<>(options);
    algorithms = List.copyOf(algorithms);
  }

  /**
   * CTAP2 encoding {@code {1: versions, 3: aaguid, 4: options, 0x0A: algorithms,
   * 0x14: remainingDiscoverableCredentials}}.
   *
   * @return the byte [ ]
   */
  public byte[] toCbor() {
    return CtapCbor.encode(generator -> {
      generator.writeStartObject(null, options.isEmpty() ? 4 : 5);
      generator.writeFieldId(0x01);
      generator.writeStartArray(null, versions.size());
      for (String version : versions) {
        generator.writeString(version);
      }
      generator.writeEndArray();
      generator.writeFieldId(0x03);
      generator.writeBinary(aaguid.bytes());
      if (!options.isEmpty()) {
        generator.writeFieldId(0x04);
        generator.writeStartObject(null, options.size());
        for (Map.Entry<String, Boolean> option : options.entrySet()) {
          generator.writeFieldName(option.getKey());
          generator.writeBoolean(option.getValue());
        }
        generator.writeEndObject();
      }
      generator.writeFieldId(0x0A);
      generator.writeStartArray(null, algorithms.size());
      for (PublicKeyCredentialParameters algorithm : algorithms) {
        algorithm.writeCbor(generator);
      }
      generator.writeEndArray();
      generator.writeFieldId(0x14);
      generator.writeNumber(remainingDiscoverableCredentials);
      generator.writeEndObject();
    });
  }
}
