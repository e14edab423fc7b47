package io.hearthwarrio.veilguard.core.host;

import java.util.List;

/**
 * Opaque handle to an element of the externally owned document tree.
 * <p>
 * Veilguard never owns the tree; it only references elements through this interface.
 * Hosts must hand out one canonical handle per underlying element, because the engine keys
 * its bookkeeping (processed set, guarded media, alert windows) by object identity.
 * <p>
 * Reads may fail once the element is detached or otherwise inaccessible. Implementations signal that
 * with {@link HostAccessException} (or any other unchecked exception); callers treat such failures
 * as "no match".
 */
public interface HostNode {

    /**
     * @return lower-case tag name, never null
     */
    String getTagName();

    /**
     * @param name attribute name
     * @return attribute value, or null when the attribute is absent
     */
    String getAttribute(String name);

    default boolean hasAttribute(String name) {
        return getAttribute(name) != null;
    }

    void setAttribute(String name, String value);

    /**
     * @return raw class attribute, or empty string when absent
     */
    default String getClassName() {
        String c = getAttribute("class");
        return c == null ? "" : c;
    }

    /**
     * @return parent element, or null for the root or a detached element
     */
    HostNode getParent();

    /**
     * @return element children in document order (may be empty, never null)
     */
    List<HostNode> getChildren();

    /**
     * @return true while the element is attached to the live document
     */
    boolean isConnected();

    /**
     * Evaluates a structural selector (or selector group) against this element.
     *
     * @param selector selector text
     * @return true if the element matches
     * @throws RuntimeException when the selector is malformed (host specific)
     */
    boolean matches(String selector);

    /**
     * @param selector selector text
     * @return first matching descendant (this element excluded), or null
     */
    HostNode querySelector(String selector);

    /**
     * @param selector selector text
     * @return matching descendants (this element excluded) in document order
     */
    List<HostNode> querySelectorAll(String selector);

    /**
     * @return resolved style of the element
     * @throws HostAccessException when the style cannot be computed (for example, detached element)
     */
    ComputedStyle getComputedStyle();

    /**
     * @return layout box relative to the viewport
     * @throws HostAccessException when geometry is not available
     */
    Rect getBoundingRect();

    /**
     * @return rendered text of the element and its descendants (may be empty, never null)
     */
    String getInnerText();

    /**
     * Writes an inline style property.
     *
     * @param property  CSS property name
     * @param value     CSS value
     * @param important whether to use maximal override priority
     */
    void setStyleProperty(String property, String value, boolean important);

    void setTextContent(String text);

    void appendChild(HostNode child);

    /**
     * Detaches the element from its parent.
     *
     * @throws HostAccessException when the element is already detached or cannot be removed
     */
    void remove();

    void addEventListener(String type, HostEventListener listener, boolean capture);

    /**
     * Inclusive containment check based on the parent chain.
     *
     * @param other other element
     * @return true if {@code other} is this element or one of its descendants
     */
    default boolean contains(HostNode other) {
        for (HostNode n = other; n != null; n = n.getParent()) {
            if (n == this) {
                return true;
            }
        }
        return false;
    }
}
