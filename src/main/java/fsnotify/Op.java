package fsnotify;

import java.util.EnumSet;
import java.util.Set;

/**
 * A filesystem operation reported by the helper.
 *
 * The helper packs these into the low five bits of an integer, most significant first:
 * chmod, rename, remove, write, create.
 */
public enum Op {
  CREATE(1),
  WRITE(1 << 1),
  REMOVE(1 << 2),
  RENAME(1 << 3),
  CHMOD(1 << 4);

  /** Bits above these are ignored when decoding. */
  public static final int MASK = 0b11111;

  private final int bit;

  Op(int bit) {
    this.bit = bit;
  }

  public int getBit() {
    return bit;
  }

  public static EnumSet<Op> fromMask(int mask) {
    EnumSet<Op> ops = EnumSet.noneOf(Op.class);
    for (Op op : values()) {
      if ((mask & op.bit) != 0) {
        ops.add(op);
      }
    }
    return ops;
  }

  public static int toMask(Set<Op> ops) {
    int mask = 0;
    for (Op op : ops) {
      mask |= op.bit;
    }
    return mask;
  }
}
