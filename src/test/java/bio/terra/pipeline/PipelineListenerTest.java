package bio.terra.pipeline;

import static bio.terra.pipeline.fixtures.TestUtil.buildPlan;
import static bio.terra.pipeline.fixtures.TestUtil.callableRef;
import static bio.terra.pipeline.fixtures.TestUtil.hook;
import static bio.terra.pipeline.fixtures.TestUtil.recordingCallables;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import bio.terra.pipeline.fixtures.TestListener;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
public class PipelineListenerTest {

  @Mock private PipelineListener listener;
  @Captor private ArgumentCaptor<HookError> errorCaptor;

  private final List<String> executionLog = new ArrayList<>();

  @Test
  public void failingListenerIsIgnored() throws Exception {
    doThrow(new RuntimeException("listener broke")).when(listener).startHook(any(), any());
    TestListener recorder = new TestListener();
    ExecutionPlan plan = buildPlan(hook("execute1", HookPhase.EXECUTE));

    PipelineResult result =
        new PipelineRunnerBuilder()
            .plan(plan)
            .resolver(recordingCallables(executionLog, "execute1"))
            .listener(listener)
            .listener(recorder)
            .runId("listened")
            .build()
            .run();

    assertTrue(result.isSuccess());
    assertThat(executionLog, contains("execute1"));
    assertThat(recorder.getEventLog(), hasItem("startHook:execute1"));
    verify(listener).startRun(eq("listened"), any());
    verify(listener, times(HookPhase.values().length)).startPhase(any(), any());
    verify(listener).endHook(any(), any());
    verify(listener).endRun(eq("listened"), any(), isNull());
  }

  @Test
  public void capturedAndAbortingErrorsReachListener() {
    IllegalStateException boom = new IllegalStateException("boom");
    ExecutionPlan plan =
        buildPlan(hook("execute1", HookPhase.EXECUTE), hook("finalize1", HookPhase.FINALIZE));
    CallableRegistry callables =
        new CallableRegistry()
            .direct(
                callableRef("execute1"),
                context -> {
                  throw boom;
                })
            .direct(
                callableRef("finalize1"),
                context -> {
                  throw new IllegalArgumentException("cleanup failed");
                });
    PipelineRunner runner =
        new PipelineRunnerBuilder().plan(plan).resolver(callables).listener(listener).build();

    assertThrows(IllegalStateException.class, runner::run);

    verify(listener).hookFailed(errorCaptor.capture(), eq(false));
    assertThat(errorCaptor.getValue().getHookId(), equalTo("execute1"));
    verify(listener).hookFailed(errorCaptor.capture(), eq(true));
    assertThat(errorCaptor.getValue().getHookId(), equalTo("finalize1"));
    assertThat(errorCaptor.getValue().getPhase(), equalTo(HookPhase.FINALIZE));
    verify(listener).endRun(any(), any(), same(boom));
  }
}
