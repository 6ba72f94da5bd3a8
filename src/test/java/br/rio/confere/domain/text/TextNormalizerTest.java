package br.rio.confere.domain.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TextNormalizerTest {

  @Test
  void foldsAccentsCaseAndPunctuation() {
    assertEquals("secretaria municipal de saude sms",
        TextNormalizer.normalize("  Secretaria Municipal de Saúde - (SMS)  "));
  }

  @Test
  void nullBecomesEmpty() {
    assertEquals("", TextNormalizer.normalize(null));
    assertTrue(TextNormalizer.tokens(null).isEmpty());
    assertTrue(TextNormalizer.tokens(" ,;. ").isEmpty());
  }

  @ParameterizedTest
  @ValueSource(strings = {
      "Prestação de Serviços de Manutenção",
      "R$ 1.234.567,89",
      "SMS-PRO-2025/00001",
      "ÁGUA   e\tESGOTO",
      ""
  })
  void normalizingTwiceChangesNothing(String raw) {
    String once = TextNormalizer.normalize(raw);

    assertEquals(once, TextNormalizer.normalize(once));
  }

  @Test
  void tokensFollowNormalizedOrder() {
    assertEquals(List.of("contrato", "045", "2025"), TextNormalizer.tokens("Contrato: 045/2025."));
  }
}
