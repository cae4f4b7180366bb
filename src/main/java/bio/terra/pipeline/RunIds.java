package bio.terra.pipeline;

import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.UUID;

/**
 * Run ids are random UUIDs written in base64url instead of hex with hyphens: 22 characters instead
 * of 36, and safe in log lines, URLs and file names.
 */
public class RunIds {
  private RunIds() {}

  public static String newRunId() {
    UUID uuid = UUID.randomUUID();
    ByteBuffer byteBuffer = ByteBuffer.allocate(16);
    byteBuffer.putLong(uuid.getMostSignificantBits());
    byteBuffer.putLong(uuid.getLeastSignificantBits());
    return Base64.getUrlEncoder().withoutPadding().encodeToString(byteBuffer.array());
  }
}
