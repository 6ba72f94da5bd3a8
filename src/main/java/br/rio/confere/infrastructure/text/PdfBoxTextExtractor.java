package br.rio.confere.infrastructure.text;

import br.rio.confere.application.error.ParsingException;
import br.rio.confere.application.port.DocumentTextExtractor;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Pattern;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link DocumentTextExtractor} for gazette pages and contract documents.
 * <p>PDF files (detected by their {@code %PDF} signature) go through PDFBox; anything else is read as UTF-8
 * HTML or text with markup stripped.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a new stripper is created per document.</p>
 *
 * @implNote Scanned PDFs without a text layer produce no text and are reported as unreadable.
 */
public final class PdfBoxTextExtractor implements DocumentTextExtractor {
  private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);
  private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);
  private static final Pattern SCRIPT = Pattern.compile("(?is)<(script|style)[^>]*>.*?</\\1>");
  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern BLANKS = Pattern.compile("[ \\t\\x0B\\f\\r]+");

  @Override
  public String extractText(Path document) {
    String text;
    try {
      text = isPdf(document) ? pdfText(document) : markupText(document);
    } catch (IOException ex) {
      throw new ParsingException("unable to read document " + document.getFileName(), ex);
    }
    if (text.isBlank()) {
      throw new ParsingException("document has no extractable text: " + document.getFileName());
    }
    log.debug("Extracted {} characters from {}", text.length(), document.getFileName());
    return text;
  }

  private static boolean isPdf(Path document) throws IOException {
    try (InputStream in = Files.newInputStream(document)) {
      byte[] head = in.readNBytes(PDF_MAGIC.length);
      return Arrays.equals(head, PDF_MAGIC);
    }
  }

  private static String pdfText(Path document) throws IOException {
    try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      return stripper.getText(pdf).strip();
    }
  }

  static String markupText(Path document) throws IOException {
    String raw = Files.readString(document, StandardCharsets.UTF_8);
    String withoutScripts = SCRIPT.matcher(raw).replaceAll(" ");
    String withoutTags = TAG.matcher(withoutScripts).replaceAll(" ");
    String decoded = withoutTags
        .replace("&nbsp;", " ")
        .replace("&amp;", "&")
        .replace("&lt;", "<")
        .replace("&gt;", ">")
        .replace("&quot;", "\"");
    return BLANKS.matcher(decoded).replaceAll(" ").strip();
  }
}
