package com.codeheadsystems.fido2.api.cbor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.cbor.CBORFactory;
import com.fasterxml.jackson.dataformat.cbor.CBORGenerator;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * CTAP2 CBOR encoding on top of Jackson's CBOR backend.
 * <p>
 * Writers must emit definite-length maps and arrays with keys already in CTAP2 canonical
 * order (integers ascending, then shorter text keys first), since the generator writes keys
 * in call order.
 */
public class CtapCbor {

  private static final CBORFactory FACTORY = new CBORFactory();
  private static final CBORMapper MAPPER = new CBORMapper(FACTORY);

  private CtapCbor() {
  }

  /**
   * Encodes a single top-level CBOR item written by the given writer.
   *
   * @param writer the writer
   * @return the encoded bytes
   */
  public static byte[] encode(final CborWriter writer) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (CBORGenerator generator = FACTORY.createGenerator(out)) {
      writer.write(generator);
    } catch (IOException e) {
      throw new UncheckedIOException("CBOR encoding failed", e);
    }
    return out.toByteArray();
  }

  /**
   * Decodes CBOR into a Jackson tree. Integer map keys become their decimal string form.
   *
   * @param cbor the cbor
   * @return the json node
   */
  public static JsonNode decode(final byte[] cbor) {
    try {
      return MAPPER.readTree(cbor);
    } catch (IOException e) {
      throw new IllegalArgumentException("Invalid CBOR", e);
    }
  }

  /**
   * Writes one CBOR item to a generator.
   */
  @FunctionalInterface
  public interface CborWriter {

    /**
     * Write.
     *
     * @param generator the generator
     * @throws IOException on generator failure
     */
    void write(CBORGenerator generator) throws IOException;
  }
}
