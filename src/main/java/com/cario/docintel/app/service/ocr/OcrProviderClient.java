package com.cario.docintel.app.service.ocr;

import com.cario.docintel.app.exception.OcrValidationException;
import com.cario.docintel.app.model.JobHandle;
import com.cario.docintel.app.model.OcrRequest;
import com.cario.docintel.app.model.PollOutcome;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.apache.commons.io.FilenameUtils;

/**
 * One asynchronous OCR provider: submit a file, then poll the returned handle until the job is
 * complete. Implementations hold no per-job state and are safe to share across threads.
 *
 * <p>Every failure is raised as a subtype of {@link
 * com.cario.docintel.app.exception.OcrException}.
 */
public interface OcrProviderClient {

  int MAX_LANGUAGES = 4;

  String OCTET_STREAM = "application/octet-stream";

  Map<String, String> MIME_BY_EXTENSION =
      Map.ofEntries(
          Map.entry("pdf", "application/pdf"),
          Map.entry("png", "image/png"),
          Map.entry("jpg", "image/jpeg"),
          Map.entry("jpeg", "image/jpeg"),
          Map.entry("webp", "image/webp"),
          Map.entry("gif", "image/gif"),
          Map.entry("tif", "image/tiff"),
          Map.entry("tiff", "image/tiff"),
          Map.entry("doc", "application/msword"),
          Map.entry(
              "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
          Map.entry("html", "text/html"),
          Map.entry("epub", "application/epub+zip"));

  /** Stable name used in results, logs and stats. */
  String name();

  /**
   * Identity of the credential this client sends. Two clients with the same id fail
   * authentication together, so an authentication error is never failed over between them.
   */
  String credentialId();

  /** True when the provider returns layout structure rather than native per-line confidence. */
  boolean structureOriented();

  Set<String> supportedMimeTypes();

  long maxFileSizeBytes();

  /** Upper bound for a single submit or poll HTTP call. */
  Duration requestTimeout();

  /** Local preconditions; never touches the network. */
  default void validate(OcrRequest request) {
    if (request.size() == 0) {
      throw new OcrValidationException(name(), "file is empty");
    }
    if (request.size() > maxFileSizeBytes()) {
      throw new OcrValidationException(
          name(),
          "file size " + request.size() + " bytes exceeds limit of " + maxFileSizeBytes());
    }
    String mime = normalizeMimeType(request.getMimeType());
    if (!supportedMimeTypes().contains(mime)) {
      throw new OcrValidationException(name(), "unsupported mime type: " + mime);
    }
    if (request.getOptions() != null
        && request.getOptions().getLanguages() != null
        && request.getOptions().getLanguages().size() > MAX_LANGUAGES) {
      throw new OcrValidationException(
          name(), "at most " + MAX_LANGUAGES + " language hints are supported");
    }
  }

  JobHandle submit(OcrRequest request, Duration timeout);

  PollOutcome poll(JobHandle handle, Duration timeout);

  /**
   * Normalized MIME type, inferred from the filename extension when the upload carries none or
   * only {@code application/octet-stream}.
   */
  static String resolveMimeType(String mimeType, String filename) {
    String mime = normalizeMimeType(mimeType);
    if (!mime.isEmpty() && !OCTET_STREAM.equals(mime)) {
      return mime;
    }
    String ext = filename == null ? "" : FilenameUtils.getExtension(filename);
    String inferred = MIME_BY_EXTENSION.get(ext.toLowerCase(Locale.ROOT));
    return inferred != null ? inferred : mime;
  }

  /** Lower-cases and strips parameters, e.g. {@code Image/PNG; q=1} becomes {@code image/png}. */
  static String normalizeMimeType(String mimeType) {
    if (mimeType == null) {
      return "";
    }
    int semi = mimeType.indexOf(';');
    String base = semi >= 0 ? mimeType.substring(0, semi) : mimeType;
    return base.trim().toLowerCase(Locale.ROOT);
  }
}
