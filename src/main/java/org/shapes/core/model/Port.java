package org.shapes.core.model;

import java.util.Objects;

public class Port {

    /** индекс ребра (не проверяется против числа вершин) */
    public int edge;
    /** доля длины ребра, обычно 0..1 */
    public double position;
    /** отсутствующий тип хранится как DEFAULT */
    public PortType portType = PortType.DEFAULT;

    public Port(int edge, double position) {
        this.edge = edge;
        this.position = position;
    }

    public Port(int edge, double position, PortType portType) {
        this.edge = edge;
        this.position = position;
        this.portType = (portType != null) ? portType : PortType.DEFAULT;
    }

    public boolean isTyped() {
        return portType != null && portType != PortType.DEFAULT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Port)) return false;
        Port p = (Port) o;
        return edge == p.edge
                && Double.compare(position, p.position) == 0
                && portType == p.portType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(edge, position, portType);
    }

    @Override
    public String toString() {
        return "{" + edge + ", " + position + (isTyped() ? ", " + portType.token : "") + "}";
    }
}
