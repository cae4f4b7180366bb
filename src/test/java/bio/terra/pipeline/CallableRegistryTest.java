package bio.terra.pipeline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.pipeline.exception.DuplicateCallableException;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
public class CallableRegistryTest {

  @Test
  public void resolveBothKinds() {
    CallableRegistry callables =
        new CallableRegistry()
            .direct("hooks.validate", context -> context.put("validated", true))
            .suspending("hooks.fetch", context -> CompletableFuture.completedFuture(null));

    assertThat(callables.size(), equalTo(2));
    assertThat(callables.resolve("hooks.validate").get(), instanceOf(DirectHook.class));
    assertThat(callables.resolve("hooks.fetch").get(), instanceOf(SuspendingHook.class));
    assertFalse(callables.resolve("hooks.unknown").isPresent());
  }

  @Test
  public void duplicateReference() {
    CallableRegistry callables = new CallableRegistry().direct("hooks.one", context -> {});
    DuplicateCallableException ex =
        assertThrows(
            DuplicateCallableException.class,
            () ->
                callables.suspending(
                    "hooks.one", context -> CompletableFuture.completedFuture(null)));
    assertThat(ex.getCallableRef(), equalTo("hooks.one"));
    assertThat(
        "The first body is kept",
        callables.resolve("hooks.one").get(),
        instanceOf(DirectHook.class));
  }
}
