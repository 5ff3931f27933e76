package com.formulagraph.app.models;

import java.util.*;

/**
 * Resolved cell values a formula is evaluated against.
 * - unqualified references resolve on the home sheet
 * - addresses marked unresolved (circular or failed cells) yield UNRESOLVED_REFERENCE
 * - any other missing address falls back to the fallback value and is recorded as defaulted
 */
public class EvaluationContext {

    private final String homeSheet;
    private final Map<QualifiedAddress, Object> values;
    private final Set<QualifiedAddress> unresolved;

    public EvaluationContext(String homeSheet) {
        this(homeSheet, new LinkedHashMap<>(), new HashSet<>());
    }

    private EvaluationContext(String homeSheet, Map<QualifiedAddress, Object> values, Set<QualifiedAddress> unresolved) {
        this.homeSheet = homeSheet;
        this.values = values;
        this.unresolved = unresolved;
    }

    /**
     * A view over the same values with another home sheet. Writes through either view are shared.
     */
    public EvaluationContext onSheet(String sheet) {
        return new EvaluationContext(sheet, values, unresolved);
    }

    public String getHomeSheet() {
        return homeSheet;
    }

    /**
     * Puts a value under "A1" (home sheet) or "Sheet2!A1".
     */
    public EvaluationContext put(String address, Object value) {
        return put(resolveKey(address), value);
    }

    public EvaluationContext put(QualifiedAddress address, Object value) {
        Object normalized = value instanceof Number ? ((Number) value).doubleValue() : value;
        values.put(address.withoutDocument(), normalized);
        unresolved.remove(address.withoutDocument());
        return this;
    }

    public EvaluationContext markUnresolved(QualifiedAddress address) {
        values.remove(address.withoutDocument());
        unresolved.add(address.withoutDocument());
        return this;
    }

    public boolean contains(QualifiedAddress address) {
        return values.containsKey(address) && values.get(address) != null;
    }

    public boolean isUnresolved(QualifiedAddress address) {
        return unresolved.contains(address);
    }

    public Object get(QualifiedAddress address) {
        return values.get(address);
    }

    /**
     * Values present inside a rectangle of one sheet, ordered row by row.
     * Empty cells of the range are simply absent.
     */
    public SortedMap<CellAddress, Object> valuesIn(String sheet, CellAddress start, CellAddress end) {
        SortedMap<CellAddress, Object> inRange = new TreeMap<>();
        for (Map.Entry<QualifiedAddress, Object> entry : values.entrySet()) {
            QualifiedAddress address = entry.getKey();
            if (entry.getValue() != null && address.getSheet().equals(sheet) && within(address.getCell(), start, end)) {
                inRange.put(address.getCell(), entry.getValue());
            }
        }
        return inRange;
    }

    /**
     * Unresolved addresses inside a rectangle of one sheet.
     */
    public List<QualifiedAddress> unresolvedIn(String sheet, CellAddress start, CellAddress end) {
        List<QualifiedAddress> inRange = new ArrayList<>();
        for (QualifiedAddress address : unresolved) {
            if (address.getSheet().equals(sheet) && within(address.getCell(), start, end)) {
                inRange.add(address);
            }
        }
        Collections.sort(inRange);
        return inRange;
    }

    private static boolean within(CellAddress cell, CellAddress start, CellAddress end) {
        return cell.getRow() >= start.getRow() && cell.getRow() <= end.getRow()
                && cell.getColumn() >= start.getColumn() && cell.getColumn() <= end.getColumn();
    }

    private QualifiedAddress resolveKey(String address) {
        if (address.indexOf('!') >= 0) {
            return QualifiedAddress.parse(address);
        }
        return QualifiedAddress.of(homeSheet, address);
    }
}
