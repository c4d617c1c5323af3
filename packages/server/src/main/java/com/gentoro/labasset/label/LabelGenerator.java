package com.gentoro.labasset.label;

import com.gentoro.labasset.config.ConfigSnapshot;
import com.gentoro.labasset.config.ConfigStore;
import com.gentoro.labasset.exception.EncodingException;
import com.gentoro.labasset.exception.ErrorKind;
import com.gentoro.labasset.exception.InvalidInputException;
import com.gentoro.labasset.exception.LabAssetException;
import com.gentoro.labasset.logging.LoggingService;
import com.gentoro.labasset.record.RecordSettings;
import com.gentoro.labasset.utility.FileUtility;
import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Renders QR labels for records. The payload is the record's page in the record-system web
 * interface, so the same id always yields the same code.
 */
public class LabelGenerator {
  private static final Logger log = LoggingService.getLogger(LabelGenerator.class);
  static final int MAX_TITLE_LENGTH = 60;

  private final ConfigStore config;

  public LabelGenerator(ConfigStore config) {
    this.config = config;
  }

  /** Generate with the configured profile. */
  public Label generate(String externalId, String title) {
    return generate(
        externalId,
        title,
        EncodingProfile.fromId(config.snapshot().getString("pipeline.labelProfile", "standard")));
  }

  /**
   * Encode and write the label image to {@code storage.labelsDir}. An existing label for the same
   * record and title is replaced.
   *
   * @throws EncodingException when the payload does not fit the profile's maximum version
   */
  public Label generate(String externalId, String title, EncodingProfile profile) {
    if (externalId == null || externalId.isBlank()) {
      throw new InvalidInputException("A label needs the external id of a created record");
    }
    ConfigSnapshot snapshot = config.snapshot();
    String payload = payload(RecordSettings.from(snapshot).webBaseUrl(), externalId);
    Map<EncodeHintType, Object> hints = hints(profile);

    QRCode code;
    try {
      code = Encoder.encode(payload, profile.errorCorrection(), hints);
    } catch (WriterException e) {
      throw new EncodingException("Payload cannot be encoded as a QR code: " + payload, e);
    }
    int version = code.getVersion().getVersionNumber();
    if (version > profile.maxVersion()) {
      throw new EncodingException(
          "Payload of "
              + payload.length()
              + " characters needs QR version "
              + version
              + ", profile "
              + profile.id()
              + " allows "
              + profile.maxVersion());
    }

    int modules = code.getMatrix().getWidth() + 2 * profile.margin();
    int size = modules * profile.modulePixels();
    byte[] png;
    try {
      BitMatrix matrix =
          new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, size, size, hints);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      MatrixToImageWriter.writeToStream(matrix, "PNG", out);
      png = out.toByteArray();
    } catch (WriterException | IOException e) {
      throw new EncodingException("QR rendering failed for record " + externalId, e);
    }

    Path target =
        Path.of(snapshot.getString("storage.labelsDir", "labels"))
            .resolve(fileName(title, externalId));
    try {
      FileUtility.writeAtomically(target, png);
    } catch (IOException e) {
      throw new LabAssetException(ErrorKind.STORAGE_ERROR, "Could not write label " + target, e)
          .withContext("externalId", externalId);
    }
    log.info("Label for record {} written to {} (QR version {})", externalId, target, version);
    return new Label(externalId, payload, target, profile, version, Instant.now());
  }

  /** Deterministic label content for a record. */
  public static String payload(String webBaseUrl, String externalId) {
    return webBaseUrl + "/database.php?mode=view&id=" + externalId;
  }

  static String fileName(String title, String externalId) {
    String name = FileUtility.sanitizeFileName(title, MAX_TITLE_LENGTH);
    if (name.isEmpty()) name = "asset";
    return name + "_" + FileUtility.sanitizeFileName(externalId, MAX_TITLE_LENGTH) + ".png";
  }

  private static Map<EncodeHintType, Object> hints(EncodingProfile profile) {
    Map<EncodeHintType, Object> hints = new EnumMap<>(EncodeHintType.class);
    hints.put(EncodeHintType.ERROR_CORRECTION, profile.errorCorrection());
    hints.put(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
    hints.put(EncodeHintType.MARGIN, profile.margin());
    return hints;
  }
}
