package io.b2mash.b2b.contractassembly.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.contractassembly.TestcontainersConfiguration;
import io.b2mash.b2b.contractassembly.exception.ConcurrentPublishException;
import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import io.b2mash.b2b.contractassembly.rule.Rule;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ConcurrentPublishIntegrationTest {

  private static final String TENANT = "tenant_concurrency";

  private final UUID authorId = UUID.randomUUID();
  private final UUID reviewerId = UUID.randomUUID();
  private final ExecutorService executor = Executors.newFixedThreadPool(2);

  @Autowired private ClauseLifecycleService clauseService;
  @Autowired private ClauseRepository clauseRepository;
  @Autowired private ClauseVersionRepository clauseVersionRepository;
  @Autowired private PlatformTransactionManager transactionManager;

  @AfterAll
  void shutdown() {
    executor.shutdownNow();
  }

  @Test
  void exactlyOneOfTwoConcurrentApprovalsPublishes() throws Exception {
    UUID clauseId = inScope(authorId, () -> createClause("Liability cap")).getId();
    UUID first = draftInReview(clauseId);
    UUID second = draftInReview(clauseId);

    var firstApproved = new CountDownLatch(1);
    var transactionTemplate = new TransactionTemplate(transactionManager);

    // The first approval holds its transaction open while the second one runs into it.
    Future<UUID> winner =
        executor.submit(
            () ->
                inScope(
                    reviewerId,
                    () ->
                        transactionTemplate.execute(
                            status -> {
                              var published = clauseService.approve(first, reviewerId);
                              firstApproved.countDown();
                              pause(2_000);
                              return published.getId();
                            })));
    Future<UUID> loser =
        executor.submit(
            () -> {
              assertThat(firstApproved.await(10, TimeUnit.SECONDS)).isTrue();
              return inScope(reviewerId, () -> clauseService.approve(second, reviewerId).getId());
            });

    assertThat(winner.get(30, TimeUnit.SECONDS)).isEqualTo(first);
    assertThatThrownBy(() -> loser.get(30, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(ConcurrentPublishException.class);

    assertThat(clauseVersionRepository.findByEntityIdAndStatus(clauseId, VersionStatus.PUBLISHED))
        .extracting(ClauseVersion::getId)
        .containsExactly(first);
    assertThat(clauseVersionRepository.findById(second).orElseThrow().getStatus())
        .isEqualTo(VersionStatus.REVIEW);
    assertThat(clauseRepository.findById(clauseId).orElseThrow().getCurrentPublishedVersionId())
        .isEqualTo(first);
  }

  @Test
  void sequentialApprovalDeprecatesPreviouslyPublishedVersion() {
    UUID clauseId = inScope(authorId, () -> createClause("Governing law")).getId();
    UUID first = draftInReview(clauseId);
    UUID second = draftInReview(clauseId);

    inScope(reviewerId, () -> clauseService.approve(first, reviewerId));
    inScope(reviewerId, () -> clauseService.approve(second, reviewerId));

    var deprecated = clauseVersionRepository.findById(first).orElseThrow();
    assertThat(deprecated.getStatus()).isEqualTo(VersionStatus.DEPRECATED);
    assertThat(clauseVersionRepository.findById(second).orElseThrow().getStatus())
        .isEqualTo(VersionStatus.PUBLISHED);
    assertThat(clauseRepository.findById(clauseId).orElseThrow().getCurrentPublishedVersionId())
        .isEqualTo(second);
  }

  private Clause createClause(String title) {
    return clauseService.createClause(title, "DE", "civil", List.of());
  }

  private UUID draftInReview(UUID clauseId) {
    return inScope(
        authorId,
        () -> {
          var content =
              new ClauseContent(
                  "Liability is limited to the contract value.",
                  null,
                  List.of(new Rule.ScopedTo(List.of("DE"), null, null, null, null)),
                  null,
                  null);
          var draft = clauseService.createDraft(clauseId, content, authorId);
          return clauseService.submitForReview(draft.getId(), reviewerId).version().getId();
        });
  }

  private static <T> T inScope(UUID actorId, Supplier<T> action) {
    return RequestScopes.call(new RequestScopes.Scope(TENANT, actorId, "editor"), action);
  }

  private static void pause(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
