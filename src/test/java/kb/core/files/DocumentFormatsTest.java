package kb.core.files;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DocumentFormatsTest {
  @Test
  void isSupported_acceptsPdfMarkdownAndText_caseInsensitively() {
    assertTrue(DocumentFormats.isSupported("guide.PDF"));
    assertTrue(DocumentFormats.isSupported("faq.md"));
    assertTrue(DocumentFormats.isSupported("dir/notes.txt"));
    assertFalse(DocumentFormats.isSupported("image.png"));
    assertFalse(DocumentFormats.isSupported("README"));
    assertFalse(DocumentFormats.isSupported("trailing."));
  }

  @Test
  void isPlainText_excludesPdf() {
    assertTrue(DocumentFormats.isPlainText("faq.md"));
    assertFalse(DocumentFormats.isPlainText("guide.pdf"));
  }

  @Test
  void extension_usesLastPathSegment() {
    assertEquals("txt", DocumentFormats.extension("a.b/c\\notes.TXT"));
    assertNull(DocumentFormats.extension("folder.d/readme"));
  }
}
