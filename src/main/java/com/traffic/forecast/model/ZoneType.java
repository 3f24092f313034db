package com.traffic.forecast.model;

public enum ZoneType {
    RESIDENTIAL(0),
    COMMERCIAL(1),
    INDUSTRIAL(2),
    MIXED(3);

    private final int code;

    ZoneType(int code) {
        this.code = code;
    }

    public int getCode() { return code; }
}
