package org.shapes.core.model;

/**
 * Роль порта на ребре формы.
 *
 * Токены совпадают с идентификаторами, которые игра ожидает в shapes.lua
 * (третий элемент кортежа порта). Неизвестный токен не является ошибкой и даёт DEFAULT.
 */
public enum PortType {
    DEFAULT("DEFAULT"),
    THRUSTER_IN("THRUSTER_IN"),
    THRUSTER_OUT("THRUSTER_OUT"),
    WEAPON_IN("WEAPON_IN"),
    WEAPON_OUT("WEAPON_OUT"),
    MISSILE("MISSILE"),
    LAUNCHER("LAUNCHER"),
    ROOT("ROOT"),
    NONE("NONE");

    public final String token;

    PortType(String token) {
        this.token = token;
    }

    public String toToken() {
        return token;
    }

    public static PortType fromToken(String token) {
        if (token == null) return DEFAULT;
        String key = token.trim();
        for (PortType t : values()) {
            if (t.token.equals(key)) return t;
        }
        return DEFAULT;
    }
}
