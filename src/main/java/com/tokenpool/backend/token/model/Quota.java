package com.tokenpool.backend.token.model;

/**
 * 剩餘額度。DB 欄位用 int（-1 = 還沒用過、0 = 用完、正數 = 剩幾次），
 * 只有在 entity 邊界做轉換，業務邏輯一律看這個型別。
 */
public sealed interface Quota permits Quota.Unused, Quota.Exhausted, Quota.Remaining {

    int UNUSED_RAW = -1;
    int EXHAUSTED_RAW = 0;

    Quota UNUSED = new Unused();
    Quota EXHAUSTED = new Exhausted();

    int toRaw();

    static Quota fromRaw(int raw) {
        if (raw == UNUSED_RAW) return UNUSED;
        if (raw == EXHAUSTED_RAW) return EXHAUSTED;
        return new Remaining(raw);
    }

    /** admin 輸入檢查：只接受 -1 / 0 / 正數 */
    static boolean isValidRaw(int raw) {
        return raw >= UNUSED_RAW;
    }

    default boolean isUnused() {
        return this instanceof Unused;
    }

    default boolean isExhausted() {
        return this instanceof Exhausted;
    }

    record Unused() implements Quota {
        @Override
        public int toRaw() {
            return UNUSED_RAW;
        }
    }

    record Exhausted() implements Quota {
        @Override
        public int toRaw() {
            return EXHAUSTED_RAW;
        }
    }

    record Remaining(int count) implements Quota {
        public Remaining {
            if (count <= 0) throw new IllegalArgumentException("QUOTA_INVALID");
        }

        @Override
        public int toRaw() {
            return count;
        }
    }
}
