package io.hearthwarrio.veilguard.testkit;

import io.hearthwarrio.veilguard.core.host.HostDocument;
import io.hearthwarrio.veilguard.core.host.HostEventListener;
import io.hearthwarrio.veilguard.core.host.HostNode;
import io.hearthwarrio.veilguard.core.host.HostScheduler;
import io.hearthwarrio.veilguard.core.host.Mutation;
import io.hearthwarrio.veilguard.core.host.MutationListener;
import io.hearthwarrio.veilguard.core.host.MutationSubscription;
import io.hearthwarrio.veilguard.core.host.Rect;
import io.hearthwarrio.veilguard.core.host.Viewport;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory {@link HostDocument} built on a jsoup {@link Document}.
 * <p>
 * Behaves like a browser page as far as the engine can tell:
 * <ul>
 *   <li>mutations made through the host API are recorded and delivered to observers in one batch, posted to
 *       the {@link HostScheduler}</li>
 *   <li>events dispatch through capture, target and bubble phases</li>
 *   <li>style and geometry come from the inline {@code style} attribute, or from {@link #layout(HostNode, Rect)}</li>
 * </ul>
 * Selector matching is jsoup's, so attribute value matching is case-insensitive.
 */
public final class SimulatedPage implements HostDocument {

    public static final Viewport DEFAULT_VIEWPORT = new Viewport(1280, 800);

    private final Document document;
    private final String domain;
    private final HostScheduler scheduler;

    private final Map<Element, SimulatedNode> nodes = new IdentityHashMap<>();
    private final Map<SimulatedNode, Rect> layout = new IdentityHashMap<>();
    private final Map<Object, List<ListenerEntry>> listeners = new IdentityHashMap<>();
    private final List<Observer> observers = new ArrayList<>();
    private final List<Mutation> pending = new ArrayList<>();
    private boolean deliveryPosted;
    private long deliveredBatches;

    private Viewport viewport = DEFAULT_VIEWPORT;

    public SimulatedPage(String html, String domain, HostScheduler scheduler) {
        this.document = Jsoup.parse(html == null ? "" : html);
        this.domain = domain == null ? "" : domain;
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    public Document document() {
        return document;
    }

    /**
     * @return canonical handle for {@code element}
     */
    public SimulatedNode wrap(Element element) {
        Objects.requireNonNull(element, "element must not be null");
        return nodes.computeIfAbsent(element, e -> new SimulatedNode(this, e));
    }

    SimulatedNode adopt(HostNode node) {
        if (node instanceof SimulatedNode && ((SimulatedNode) node).page() == this) {
            return (SimulatedNode) node;
        }
        throw new IllegalArgumentException("node does not belong to this page: " + node);
    }

    // ----------- HostDocument -----------

    @Override
    public String getDomain() {
        return domain;
    }

    @Override
    public HostNode getDocumentElement() {
        return wrap(document.head().parent());
    }

    @Override
    public HostNode getHead() {
        return wrap(document.head());
    }

    @Override
    public HostNode getBody() {
        Element body = document.body();
        return body == null ? null : wrap(body);
    }

    @Override
    public HostNode getElementById(String id) {
        Element e = document.getElementById(id);
        return e == null ? null : wrap(e);
    }

    @Override
    public HostNode createElement(String tagName) {
        return wrap(document.createElement(tagName.toLowerCase(Locale.ROOT)));
    }

    @Override
    public List<HostNode> querySelectorAll(String selector) {
        List<HostNode> out = new ArrayList<>();
        for (Element e : document.select(selector)) {
            if (!(e instanceof Document)) {
                out.add(wrap(e));
            }
        }
        return out;
    }

    @Override
    public Viewport getViewport() {
        return viewport;
    }

    public void setViewport(Viewport viewport) {
        this.viewport = Objects.requireNonNull(viewport, "viewport must not be null");
    }

    @Override
    public void addEventListener(String type, HostEventListener listener, boolean capture) {
        addListener(this, type, listener, capture);
    }

    @Override
    public MutationSubscription observe(MutationListener listener, Set<String> attributeFilter) {
        Observer o = new Observer(listener, attributeFilter == null ? Set.of() : Set.copyOf(attributeFilter));
        observers.add(o);
        return o;
    }

    // ----------- test helpers -----------

    /**
     * @param css selector
     * @return first matching element
     * @throws IllegalArgumentException when nothing matches
     */
    public SimulatedNode node(String css) {
        Element e = document.selectFirst(css);
        if (e == null) {
            throw new IllegalArgumentException("no element matches: " + css);
        }
        return wrap(e);
    }

    public List<HostNode> nodes(String css) {
        return querySelectorAll(css);
    }

    /**
     * Parses {@code html} and appends the result to {@code parent} as the page scripts would.
     *
     * @return appended top-level elements
     */
    public List<HostNode> appendHtml(HostNode parent, String html) {
        return insertAdjacentHtml(parent, "beforeend", html);
    }

    /**
     * @param reference reference element
     * @param position  {@code beforebegin}, {@code afterbegin}, {@code beforeend} or {@code afterend}
     * @param html      markup fragment
     * @return inserted top-level elements
     */
    public List<HostNode> insertAdjacentHtml(HostNode reference, String position, String html) {
        SimulatedNode ref = adopt(reference);
        String p = position == null ? "" : position.toLowerCase(Locale.ROOT);
        boolean sibling = "beforebegin".equals(p) || "afterend".equals(p);
        Element container = sibling ? ref.element().parent() : ref.element();
        if (container == null) {
            throw new IllegalArgumentException("cannot insert next to a detached element");
        }
        Set<Element> before = Collections.newSetFromMap(new IdentityHashMap<>());
        before.addAll(container.children());

        switch (p) {
            case "beforebegin":
                ref.element().before(html);
                break;
            case "afterbegin":
                ref.element().prepend(html);
                break;
            case "beforeend":
                ref.element().append(html);
                break;
            case "afterend":
                ref.element().after(html);
                break;
            default:
                throw new IllegalArgumentException("unknown insert position: " + position);
        }

        List<HostNode> added = new ArrayList<>();
        for (Element c : container.children()) {
            if (!before.contains(c)) {
                added.add(wrap(c));
            }
        }
        if (!(container instanceof Document)) {
            recordChildList(wrap(container), added);
        }
        return added;
    }

    /**
     * Pins the layout box of {@code node}.
     */
    public SimulatedPage layout(HostNode node, Rect rect) {
        layout.put(adopt(node), Objects.requireNonNull(rect, "rect must not be null"));
        return this;
    }

    Rect layoutOf(SimulatedNode node) {
        return layout.get(node);
    }

    /**
     * Dispatches an event through capture, target and bubble phases.
     *
     * @return the dispatched event
     */
    public SimulatedEvent dispatch(HostNode target, String type) {
        SimulatedNode t = adopt(target);
        SimulatedEvent event = new SimulatedEvent(type, t);

        List<HostNode> ancestors = new ArrayList<>();
        for (HostNode n = t.getParent(); n != null; n = n.getParent()) {
            ancestors.add(n);
        }

        if (deliver(this, event, true, false)) {
            return event;
        }
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (deliver(ancestors.get(i), event, true, false)) {
                return event;
            }
        }
        if (deliver(t, event, true, true)) {
            return event;
        }
        for (HostNode a : ancestors) {
            if (deliver(a, event, false, false)) {
                return event;
            }
        }
        deliver(this, event, false, false);
        return event;
    }

    public SimulatedEvent click(HostNode target) {
        return dispatch(target, "click");
    }

    private boolean deliver(Object target, SimulatedEvent event, boolean capture, boolean atTarget) {
        List<ListenerEntry> entries = listeners.get(target);
        if (entries != null) {
            for (ListenerEntry e : new ArrayList<>(entries)) {
                if (!e.type.equals(event.getType()) || (!atTarget && e.capture != capture)) {
                    continue;
                }
                event.delivered();
                e.listener.handleEvent(event);
            }
        }
        return event.isPropagationStopped();
    }

    void addListener(Object target, String type, HostEventListener listener, boolean capture) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.computeIfAbsent(target, k -> new ArrayList<>()).add(new ListenerEntry(type, listener, capture));
    }

    /**
     * @return number of listeners registered for {@code type} across the page
     */
    public int listenerCount(String type) {
        int n = 0;
        for (List<ListenerEntry> entries : listeners.values()) {
            for (ListenerEntry e : entries) {
                if (e.type.equals(type)) {
                    n++;
                }
            }
        }
        return n;
    }

    // ----------- mutation recording -----------

    void recordAttribute(SimulatedNode target, String name) {
        if (target.isConnected()) {
            enqueue(Mutation.attributes(target, name));
        }
    }

    void recordChildList(SimulatedNode parent, List<HostNode> added) {
        if (parent.isConnected()) {
            enqueue(Mutation.childList(parent, added));
        }
    }

    private void enqueue(Mutation m) {
        if (observers.isEmpty()) {
            return;
        }
        pending.add(m);
        if (!deliveryPosted) {
            deliveryPosted = true;
            scheduler.post(this::deliverMutations);
        }
    }

    /**
     * Delivers the recorded mutations now. Normally runs as a posted task.
     */
    public void deliverMutations() {
        deliveryPosted = false;
        if (pending.isEmpty()) {
            return;
        }
        List<Mutation> batch = new ArrayList<>(pending);
        pending.clear();
        deliveredBatches++;
        for (Observer o : new ArrayList<>(observers)) {
            if (!o.active) {
                continue;
            }
            List<Mutation> filtered = new ArrayList<>();
            for (Mutation m : batch) {
                if (m.getType() == Mutation.Type.CHILD_LIST || o.attributeFilter.contains(m.getAttributeName())) {
                    filtered.add(m);
                }
            }
            if (!filtered.isEmpty()) {
                o.listener.onMutations(filtered);
            }
        }
    }

    public int pendingMutationCount() {
        return pending.size();
    }

    public long getDeliveredBatches() {
        return deliveredBatches;
    }

    public int activeObserverCount() {
        int n = 0;
        for (Observer o : observers) {
            if (o.active) {
                n++;
            }
        }
        return n;
    }

    private static final class ListenerEntry {
        final String type;
        final HostEventListener listener;
        final boolean capture;

        ListenerEntry(String type, HostEventListener listener, boolean capture) {
            this.type = type;
            this.listener = listener;
            this.capture = capture;
        }
    }

    private final class Observer implements MutationSubscription {
        final MutationListener listener;
        final Set<String> attributeFilter;
        boolean active = true;

        Observer(MutationListener listener, Set<String> attributeFilter) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            this.attributeFilter = attributeFilter;
        }

        @Override
        public void disconnect() {
            active = false;
            observers.remove(this);
        }
    }
}
