package org.shapes.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.shapes.core.model.CannonProperties;
import org.shapes.core.model.FragmentProperties;
import org.shapes.core.model.Port;
import org.shapes.core.model.Scale;
import org.shapes.core.model.Shape;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.ShroudComponent;
import org.shapes.core.model.ThrusterProperties;
import org.shapes.core.model.Vertex;

/**
 * JSON-представление модели для внешних инструментов.
 *
 * {"shapes": [{"id": 5001, "name": "Square", "scales": [{"verts": [[5,-5], ...], "ports": [{"edge":0, "position":0.5}, ...]}], ...}]}
 *
 * Незаданные необязательные поля (null / NaN) не пишутся. Цвета - строки "0x%08x".
 * У порта "type" пишется только если он не DEFAULT.
 */
public class ShapesJsonEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public static String toJson(ShapesFile file) {
        try {
            return MAPPER.writeValueAsString(toTree(file));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode shapes JSON", e);
        }
    }

    public static ObjectNode toTree(ShapesFile file) {
        ObjectNode root = MAPPER.createObjectNode();
        ArrayNode shapes = root.putArray("shapes");
        if (file == null) return root;

        for (Shape s : file.shapes) {
            shapes.add(shapeNode(s));
        }
        return root;
    }

    private static ObjectNode shapeNode(Shape s) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", s.id);
        if (s.name != null) node.put("name", s.name);

        ArrayNode scales = node.putArray("scales");
        for (Scale sc : s.scales) {
            ObjectNode scaleNode = scales.addObject();
            ArrayNode verts = scaleNode.putArray("verts");
            for (Vertex v : sc.verts) {
                verts.addArray().add(v.x).add(v.y);
            }
            ArrayNode ports = scaleNode.putArray("ports");
            for (Port p : sc.ports) {
                ObjectNode portNode = ports.addObject();
                portNode.put("edge", p.edge);
                portNode.put("position", p.position);
                if (p.isTyped()) portNode.put("type", p.portType.toToken());
            }
        }

        if (s.launcherRadial != null) node.put("launcherRadial", s.launcherRadial);
        if (s.mirrorOf != null) node.put("mirrorOf", s.mirrorOf);
        if (s.group != null) node.put("group", s.group);
        if (s.features != null) {
            ArrayNode features = node.putArray("features");
            for (String f : s.features) features.add(f);
        }

        putColor(node, "fillColor", s.fillColor);
        putColor(node, "fillColor1", s.fillColor1);
        putColor(node, "lineColor", s.lineColor);

        putNumber(node, "durability", s.durability);
        putNumber(node, "density", s.density);
        putNumber(node, "growRate", s.growRate);

        if (s.shroud != null) {
            ArrayNode shroud = node.putArray("shroud");
            for (ShroudComponent c : s.shroud) {
                shroud.add(shroudNode(c));
            }
        }
        if (s.cannon != null) node.set("cannon", cannonNode(s.cannon));
        if (s.thruster != null) node.set("thruster", thrusterNode(s.thruster));
        return node;
    }

    private static ObjectNode shroudNode(ShroudComponent c) {
        ObjectNode node = MAPPER.createObjectNode();
        node.putArray("size").add(c.sizeX).add(c.sizeY);
        node.putArray("offset").add(c.offsetX).add(c.offsetY).add(c.offsetZ);
        node.put("taper", c.taper);
        node.put("count", c.count);
        node.put("angle", c.angle);
        node.put("triColorId", c.triColorId);
        node.put("triColor1Id", c.triColor1Id);
        node.put("lineColorId", c.lineColorId);
        node.put("shape", c.shape);
        return node;
    }

    private static ObjectNode cannonNode(CannonProperties c) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("damage", c.damage);
        node.put("power", c.power);
        node.put("roundsPerSec", c.roundsPerSec);
        node.put("muzzleVel", c.muzzleVel);
        node.put("range", c.range);
        node.put("spread", c.spread);
        if (c.roundsPerBurst != null) node.put("roundsPerBurst", c.roundsPerBurst);
        putNumber(node, "burstyness", c.burstyness);
        putColor(node, "color", c.color);
        if (c.explosive != null) node.put("explosive", c.explosive);
        if (c.fragment != null) node.set("fragment", fragmentNode(c.fragment));
        return node;
    }

    private static ObjectNode fragmentNode(FragmentProperties f) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("roundsPerBurst", f.roundsPerBurst);
        node.put("muzzleVel", f.muzzleVel);
        node.put("spread", f.spread);
        if (f.pattern != null) node.put("pattern", f.pattern);
        node.put("damage", f.damage);
        node.put("range", f.range);
        putColor(node, "color", f.color);
        return node;
    }

    private static ObjectNode thrusterNode(ThrusterProperties t) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("force", t.force);
        node.put("power", t.power);
        putColor(node, "color", t.color);
        return node;
    }

    private static void putColor(ObjectNode node, String key, Integer color) {
        if (color != null) node.put(key, ShapesSerializer.hex(color));
    }

    private static void putNumber(ObjectNode node, String key, double value) {
        if (!Double.isNaN(value)) node.put(key, value);
    }
}
