package org.shapes.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Один вариант размера (level of detail) формы: свой полигон и свои порты.
 */
public class Scale {

    public List<Vertex> verts = new ArrayList<>();
    public List<Port> ports = new ArrayList<>();

    public Scale() {
    }

    public Scale(List<Vertex> verts, List<Port> ports) {
        this.verts = verts;
        this.ports = ports;
    }

    public int edgeCount() {
        return verts.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Scale)) return false;
        Scale s = (Scale) o;
        return Objects.equals(verts, s.verts) && Objects.equals(ports, s.ports);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verts, ports);
    }
}
