package org.shapes.core.model;

import java.util.Objects;

public class ThrusterProperties {

    public double force;
    public double power;
    public Integer color;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ThrusterProperties)) return false;
        ThrusterProperties t = (ThrusterProperties) o;
        return Double.compare(force, t.force) == 0
                && Double.compare(power, t.power) == 0
                && Objects.equals(color, t.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(force, power, color);
    }
}
