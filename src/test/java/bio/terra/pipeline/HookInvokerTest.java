package bio.terra.pipeline;

import static bio.terra.pipeline.fixtures.TestUtil.hook;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
public class HookInvokerTest {

  @Test
  public void unwrapNestedWrappers() {
    IOException cause = new IOException("root");
    Exception unwrapped =
        HookInvoker.unwrap(new CompletionException(new ExecutionException(cause)));
    assertThat(unwrapped, sameInstance(cause));
  }

  @Test
  public void unwrapRethrowsErrors() {
    StackOverflowError error = new StackOverflowError();
    StackOverflowError thrown =
        assertThrows(
            StackOverflowError.class, () -> HookInvoker.unwrap(new CompletionException(error)));
    assertThat(thrown, sameInstance(error));
  }

  @Test
  public void unsupportedBody() {
    HookInvoker invoker = new HookInvoker(HookThreadPool.getDefault());
    HookBody unknownKind = new HookBody() {};
    assertThrows(
        IllegalArgumentException.class,
        () -> invoker.invoke(hook("odd", HookPhase.EXECUTE), unknownKind, new PipelineContext()));
  }
}
