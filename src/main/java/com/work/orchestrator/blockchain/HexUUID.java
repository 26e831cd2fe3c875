package com.work.orchestrator.blockchain;

import java.util.UUID;

/**
 * 以 32 位 hex（无连字符）表示的 UUID，用作 off-chain payload 的定长引用。
 */
public final class HexUUID {

    private final UUID uuid;

    private HexUUID(UUID uuid) {
        this.uuid = uuid;
    }

    public static HexUUID of(UUID uuid) {
        if (uuid == null) {
            throw new IllegalArgumentException("uuid 不能为null");
        }
        return new HexUUID(uuid);
    }

    public static HexUUID random() {
        return new HexUUID(UUID.randomUUID());
    }

    /**
     * 由内容派生的 UUID（内容寻址：相同内容得到相同引用）。
     */
    public static HexUUID fromContent(byte[] content) {
        if (content == null) {
            throw new IllegalArgumentException("content 不能为null");
        }
        return new HexUUID(UUID.nameUUIDFromBytes(content));
    }

    public static HexUUID parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("HexUUID 不能为null");
        }
        String s = value.trim();
        if (s.length() == 32) {
            s = s.substring(0, 8) + "-" + s.substring(8, 12) + "-" + s.substring(12, 16)
                    + "-" + s.substring(16, 20) + "-" + s.substring(20);
        }
        return new HexUUID(UUID.fromString(s));
    }

    public UUID toUUID() {
        return uuid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HexUUID)) return false;
        return uuid.equals(((HexUUID) o).uuid);
    }

    @Override
    public int hashCode() {
        return uuid.hashCode();
    }

    @Override
    public String toString() {
        return uuid.toString().replace("-", "");
    }
}
