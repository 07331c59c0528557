package dsc;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class StepBodyTest {

  @Test
  public void joinsWithNewline() {
    assertThat(StepBody.of("a").plus(StepBody.of("b")).text()).isEqualTo("a\nb");
  }

  @Test
  public void emptyIsIdentity() {
    StepBody body = StepBody.of("step += 1;");

    assertThat(StepBody.empty().plus(body)).isEqualTo(body);
    assertThat(body.plus(StepBody.empty())).isEqualTo(body);
    assertThat(StepBody.of("")).isEqualTo(StepBody.empty());
  }

  @Test
  public void associative() {
    StepBody a = StepBody.of("a");
    StepBody b = StepBody.of("b");
    StepBody c = StepBody.of("c");

    assertThat(a.plus(b).plus(c)).isEqualTo(a.plus(b.plus(c)));
    assertThat(StepBody.concat(ImmutableList.of(a, StepBody.empty(), b, c)).text())
        .isEqualTo("a\nb\nc");
    assertThat(StepBody.concat(ImmutableList.of()).isEmpty()).isTrue();
  }
}
