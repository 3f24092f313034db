package com.traffic.forecast.model;

import java.util.Objects;

public class GeoArea {
    private final String id;
    private final String name;
    private final ZoneType zoneType;

    public GeoArea(String id, String name, ZoneType zoneType) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name;
        this.zoneType = zoneType == null ? ZoneType.MIXED : zoneType;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public ZoneType getZoneType() { return zoneType; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GeoArea)) return false;
        return id.equals(((GeoArea) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "GeoArea{" + id + ", " + zoneType + "}";
    }
}
