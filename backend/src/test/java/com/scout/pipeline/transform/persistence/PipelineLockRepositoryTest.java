package com.scout.pipeline.transform.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class PipelineLockRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

  @Autowired private PipelineLockRepository repository;

  @Test
  void onlyOneOwnerHoldsTheLock() {
    String lock = "lock-" + UUID.randomUUID();

    assertTrue(repository.tryAcquire(lock, "a", NOW, NOW.plusSeconds(60)));
    assertFalse(repository.tryAcquire(lock, "b", NOW.plusSeconds(1), NOW.plusSeconds(61)));
    assertEquals(Optional.of("a"), repository.findOwner(lock));

    assertFalse(repository.release(lock, "b"));
    assertTrue(repository.release(lock, "a"));
    assertEquals(Optional.empty(), repository.findOwner(lock));
    assertTrue(repository.tryAcquire(lock, "b", NOW.plusSeconds(2), NOW.plusSeconds(62)));
  }

  @Test
  void expiredLockCanBeTakenOver() {
    String lock = "lock-" + UUID.randomUUID();
    assertTrue(repository.tryAcquire(lock, "crashed", NOW, NOW.plusSeconds(60)));

    assertTrue(repository.tryAcquire(lock, "successor", NOW.plusSeconds(61), NOW.plusSeconds(121)));

    assertEquals(Optional.of("successor"), repository.findOwner(lock));
    assertFalse(repository.release(lock, "crashed"));
  }

  @Test
  void refreshLockIsRegisteredByMigration() {
    assertTrue(repository.tryAcquire("gold-refresh", "short-lived", NOW, NOW.plusSeconds(1)));
    assertTrue(repository.release("gold-refresh", "short-lived"));
  }
}
