package br.rio.confere.domain.checkpoint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CheckpointTest {

  @Test
  void recordsProcessosByCanonicalForm() {
    Checkpoint checkpoint = Checkpoint.start("run-1").withProcesso("sms pro 2025 01234");

    assertTrue(checkpoint.processoDone("SMS-PRO-2025/01234"));
    assertFalse(checkpoint.processoDone("SMS-PRO-2025/09999"));
    assertNull(checkpoint.lastProcessedCompanyId());
  }

  @Test
  void companiesKeepCompletionOrder() {
    Checkpoint checkpoint = Checkpoint.start("run-1").withCompany("22").withCompany("11").withCompany("22");

    assertEquals(List.of("22", "11"), List.copyOf(checkpoint.processedCompanyIds()));
    assertEquals("22", checkpoint.lastProcessedCompanyId());
    assertTrue(checkpoint.companyDone("11"));
  }
}
