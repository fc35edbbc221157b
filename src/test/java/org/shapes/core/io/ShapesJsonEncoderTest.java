package org.shapes.core.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;
import org.shapes.core.model.CannonProperties;
import org.shapes.core.model.Port;
import org.shapes.core.model.PortType;
import org.shapes.core.model.Scale;
import org.shapes.core.model.Shape;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.Vertex;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ShapesJsonEncoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void encodesShapeTree() throws Exception {
        Shape shape = new Shape(5001, "Square");
        shape.scales.add(new Scale(
                new ArrayList<>(List.of(new Vertex(5, -5), new Vertex(-5, -5), new Vertex(-5, 5))),
                new ArrayList<>(List.of(new Port(0, 0.5), new Port(1, 0.5, PortType.THRUSTER_OUT)))));
        shape.fillColor = 0x113077;
        shape.durability = 3.0;
        CannonProperties cannon = new CannonProperties();
        cannon.damage = 12;
        cannon.explosive = "PROXIMITY";
        shape.cannon = cannon;

        ShapesFile file = new ShapesFile();
        file.shapes.add(shape);

        JsonNode root = MAPPER.readTree(ShapesJsonEncoder.toJson(file));
        JsonNode s = root.get("shapes").get(0);

        assertEquals(5001, s.get("id").asInt());
        assertEquals("Square", s.get("name").asText());
        assertEquals(-5.0, s.get("scales").get(0).get("verts").get(0).get(1).asDouble(), 0.0);
        assertFalse(s.get("scales").get(0).get("ports").get(0).has("type"));
        assertEquals("THRUSTER_OUT", s.get("scales").get(0).get("ports").get(1).get("type").asText());
        assertEquals("0x00113077", s.get("fillColor").asText());
        assertEquals(3.0, s.get("durability").asDouble(), 0.0);
        assertEquals(12.0, s.get("cannon").get("damage").asDouble(), 0.0);
        assertEquals("PROXIMITY", s.get("cannon").get("explosive").asText());
        assertFalse(s.get("cannon").has("burstyness"));
    }

    @Test
    public void absentOptionalsAreOmitted() throws Exception {
        ShapesFile file = new ShapesFile();
        file.shapes.add(new Shape(7));

        JsonNode s = MAPPER.readTree(ShapesJsonEncoder.toJson(file)).get("shapes").get(0);
        assertFalse(s.has("name"));
        assertFalse(s.has("density"));
        assertFalse(s.has("launcherRadial"));
        assertFalse(s.has("thruster"));
        assertTrue(s.get("scales").isArray());
    }

    @Test
    public void emptyFileIsEmptyArray() {
        assertEquals(0, ShapesJsonEncoder.toTree(new ShapesFile()).get("shapes").size());
        assertEquals(0, ShapesJsonEncoder.toTree(null).get("shapes").size());
    }
}
