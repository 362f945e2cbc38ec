package fsnotify;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.EnumSet;

import org.jooq.lambda.Seq;
import org.junit.Test;

public class OpTest {

  @Test
  public void shouldDecodeRemoveAndCreate() {
    assertThat(Op.fromMask(0b00101), is(EnumSet.of(Op.REMOVE, Op.CREATE)));
  }

  @Test
  public void shouldDecodeNothing() {
    assertThat(Op.fromMask(0), is(EnumSet.noneOf(Op.class)));
  }

  @Test
  public void shouldDecodeEverything() {
    assertThat(Op.fromMask(0b11111), is(EnumSet.allOf(Op.class)));
  }

  @Test
  public void shouldUseTheHelpersBitOrder() {
    assertThat(describe(0b10000), is("CHMOD"));
    assertThat(describe(0b01000), is("RENAME"));
    assertThat(describe(0b00100), is("REMOVE"));
    assertThat(describe(0b00010), is("WRITE"));
    assertThat(describe(0b00001), is("CREATE"));
  }

  @Test
  public void shouldIgnoreBitsAboveTheMask() {
    assertThat(Op.fromMask(0b100010), is(EnumSet.of(Op.WRITE)));
  }

  @Test
  public void shouldEncodeBackToTheSameMask() {
    for (int mask = 0; mask <= Op.MASK; mask++) {
      assertThat(Op.toMask(Op.fromMask(mask)), is(mask));
    }
  }

  private static String describe(int mask) {
    return Seq.seq(Op.fromMask(mask)).map(Op::name).toString(",");
  }
}
