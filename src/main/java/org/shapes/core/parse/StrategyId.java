package org.shapes.core.parse;

public enum StrategyId {
    /** грамматический разбор дерева таблиц */
    STRICT,
    /** построчный эвристический сканер */
    LEGACY
}
