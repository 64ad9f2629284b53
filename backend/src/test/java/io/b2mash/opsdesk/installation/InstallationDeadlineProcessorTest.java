package io.b2mash.opsdesk.installation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class InstallationDeadlineProcessorTest {

  private static final LocalDate TODAY = LocalDate.of(2026, 5, 4);

  @Mock private InstallationJobRepository jobRepository;
  @Mock private InstallationService installationService;
  @Mock private TransactionTemplate transactionTemplate;
  @Mock private TransactionStatus transactionStatus;

  private InstallationDeadlineProcessor processor;

  @BeforeEach
  void setUp() {
    processor =
        new InstallationDeadlineProcessor(jobRepository, installationService, transactionTemplate);
  }

  private void runCallbacksInline() {
    when(transactionTemplate.execute(any()))
        .thenAnswer(
            inv -> {
              TransactionCallback<Object> callback = inv.getArgument(0);
              return callback.doInTransaction(transactionStatus);
            });
  }

  @Test
  void marksEachOverdueJobAndContinuesPastFailures() {
    runCallbacksInline();
    var first = UUID.randomUUID();
    var failing = UUID.randomUUID();
    var third = UUID.randomUUID();
    when(jobRepository.findIdsPastDeadline(InstallationService.OPEN_STATUSES, TODAY))
        .thenReturn(List.of(first, failing, third));
    when(installationService.markUndoneIfOverdue(first, TODAY)).thenReturn(true);
    when(installationService.markUndoneIfOverdue(failing, TODAY))
        .thenThrow(new IllegalStateException("boom"));
    when(installationService.markUndoneIfOverdue(third, TODAY)).thenReturn(true);

    assertThat(processor.processOverdueJobs(TODAY)).isEqualTo(2);
    verify(installationService).markUndoneIfOverdue(third, TODAY);
  }

  @Test
  void skipsSweepWhenCandidateQueryFails() {
    when(transactionTemplate.execute(any())).thenThrow(new IllegalStateException("db down"));

    assertThat(processor.processOverdueJobs(TODAY)).isZero();
    verifyNoInteractions(installationService);
  }
}
