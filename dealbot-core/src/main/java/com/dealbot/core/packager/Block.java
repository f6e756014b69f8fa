package com.dealbot.core.packager;

public record Block(Cid cid, byte[] data) {

    public int size() {
        return data.length;
    }
}
