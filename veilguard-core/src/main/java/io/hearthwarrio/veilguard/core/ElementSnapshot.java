package io.hearthwarrio.veilguard.core;

import io.hearthwarrio.veilguard.core.host.HostNode;

import java.util.Objects;

/**
 * Lightweight, detached snapshot of a hidden element used for logging.
 * <p>
 * Taking a snapshot never throws: values that cannot be read are stored as empty strings.
 */
public final class ElementSnapshot {

    private static final ElementSnapshot UNKNOWN = new ElementSnapshot("", "", "", "");

    private final String tagName;
    private final String id;
    private final String cssClasses;

    /**
     * Marker attribute name (data-element, data-izone) when present, otherwise empty.
     */
    private final String markerAttribute;

    public ElementSnapshot(String tagName, String id, String cssClasses, String markerAttribute) {
        this.tagName = normalizeNull(tagName);
        this.id = normalizeNull(id);
        this.cssClasses = normalizeNull(cssClasses);
        this.markerAttribute = normalizeNull(markerAttribute);
    }

    public static ElementSnapshot empty() {
        return UNKNOWN;
    }

    /**
     * @param node element (may be null)
     * @return snapshot of the element
     */
    public static ElementSnapshot of(HostNode node) {
        if (node == null) {
            return UNKNOWN;
        }
        return new ElementSnapshot(
                read(node, "tag"),
                read(node, "id"),
                read(node, "class"),
                AdSignatures.markerAttributeOf(node)
        );
    }

    private static String read(HostNode node, String what) {
        try {
            return "tag".equals(what) ? node.getTagName() : node.getAttribute(what);
        } catch (RuntimeException e) {
            return "";
        }
    }

    private static String normalizeNull(String s) {
        return s == null ? "" : s;
    }

    public String getTagName() {
        return tagName;
    }

    public String getId() {
        return id;
    }

    public String getCssClasses() {
        return cssClasses;
    }

    public String getMarkerAttribute() {
        return markerAttribute;
    }

    @Override
    public String toString() {
        return "ElementSnapshot{" +
                "tagName='" + tagName + '\'' +
                ", id='" + id + '\'' +
                ", cssClasses='" + cssClasses + '\'' +
                ", markerAttribute='" + markerAttribute + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ElementSnapshot)) return false;
        ElementSnapshot that = (ElementSnapshot) o;
        return Objects.equals(tagName, that.tagName) &&
                Objects.equals(id, that.id) &&
                Objects.equals(cssClasses, that.cssClasses) &&
                Objects.equals(markerAttribute, that.markerAttribute);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tagName, id, cssClasses, markerAttribute);
    }
}
