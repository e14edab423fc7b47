package io.hearthwarrio.veilguard.core.host;

import java.util.List;
import java.util.Objects;

/**
 * One recorded tree change.
 */
public final class Mutation {

    /**
     * Kind of change.
     */
    public enum Type {
        CHILD_LIST,
        ATTRIBUTES
    }

    private final Type type;
    private final HostNode target;
    private final List<HostNode> addedNodes;
    private final String attributeName;

    private Mutation(Type type, HostNode target, List<HostNode> addedNodes, String attributeName) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.addedNodes = addedNodes == null ? List.of() : List.copyOf(addedNodes);
        this.attributeName = attributeName;
    }

    /**
     * @param parent     element whose child list changed
     * @param addedNodes elements inserted under {@code parent}
     * @return child-list mutation
     */
    public static Mutation childList(HostNode parent, List<HostNode> addedNodes) {
        return new Mutation(Type.CHILD_LIST, parent, addedNodes, null);
    }

    /**
     * @param target        element whose attribute changed
     * @param attributeName changed attribute
     * @return attribute mutation
     */
    public static Mutation attributes(HostNode target, String attributeName) {
        return new Mutation(Type.ATTRIBUTES, target, List.of(), attributeName);
    }

    public Type getType() {
        return type;
    }

    public HostNode getTarget() {
        return target;
    }

    public List<HostNode> getAddedNodes() {
        return addedNodes;
    }

    /**
     * @return changed attribute name for {@link Type#ATTRIBUTES}, otherwise null
     */
    public String getAttributeName() {
        return attributeName;
    }

    @Override
    public String toString() {
        return "Mutation{" +
                "type=" + type +
                ", added=" + addedNodes.size() +
                ", attributeName='" + attributeName + '\'' +
                '}';
    }
}
