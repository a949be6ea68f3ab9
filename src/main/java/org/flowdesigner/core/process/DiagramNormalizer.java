package org.flowdesigner.core.process;

import org.flowdesigner.core.config.DesignerSettings;
import org.flowdesigner.core.process.models.DiagramDocument;
import org.flowdesigner.core.process.models.NodeKind;
import org.flowdesigner.core.process.models.RawDiagram;
import org.flowdesigner.core.process.models.RawNode;
import org.flowdesigner.core.process.models.RawTransition;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a parsed diagram document into pools, activities and transitions.
 * Nothing here is fatal: missing attributes read as empty strings.
 */
public class DiagramNormalizer {
    private static final String POOL = "Pool";
    private static final String ACTIVITY = "Activity";
    private static final String ROUTE = "Route";
    private static final String IMPLEMENTATION = "Implementation";
    private static final String TRANSITION = "Transition";

    public static RawDiagram normalize(DiagramDocument diagram) {
        return normalize(diagram, DesignerSettings.defaults());
    }

    /**
     * Normalizes one diagram. An unreadable document becomes a label-only diagram named after its entry.
     *
     * @param diagram  the parsed diagram
     * @param settings supplies the main pool name skipped during labeling
     * @return the normalized diagram, nodes in document order
     */
    public static RawDiagram normalize(DiagramDocument diagram, DesignerSettings settings) {
        if (!diagram.isReadable()) {
            return RawDiagram.labelOnly(diagram.entryName());
        }

        Element root = diagram.document().getDocumentElement();
        String ns = diagram.namespaceUri();

        List<String> poolNames = new ArrayList<>();
        for (Element pool : descendants(root, ns, POOL)) {
            poolNames.add(normalizeLabel(pool.getAttribute("Name")));
        }
        String label = chooseLabel(poolNames, diagram.entryName(), settings.mainPoolName);

        Map<String, RawNode> nodes = new LinkedHashMap<>();
        for (Element activity : descendants(root, ns, ACTIVITY)) {
            RawNode node = toNode(activity, ns);
            nodes.put(node.id(), node);
        }

        List<RawTransition> transitions = new ArrayList<>();
        for (Element transition : descendants(root, ns, TRANSITION)) {
            transitions.add(new RawTransition(
                    transition.getAttribute("From"),
                    transition.getAttribute("To"),
                    normalizeLabel(transition.getAttribute("Name"))));
        }

        return new RawDiagram(diagram.entryName(), label, nodes, transitions, true);
    }

    /**
     * Picks the diagram label: the first non-empty pool name other than the main pool, else the first pool name,
     * else the entry name.
     */
    static String chooseLabel(List<String> poolNames, String entryName, String mainPoolName) {
        if (poolNames.isEmpty()) {
            return entryName;
        }
        String mainPool = mainPoolName == null ? "" : mainPoolName.toLowerCase(Locale.ROOT);
        for (String poolName : poolNames) {
            if (!poolName.isEmpty() && !poolName.toLowerCase(Locale.ROOT).equals(mainPool)) {
                return poolName;
            }
        }
        String first = poolNames.get(0);
        return first.isEmpty() ? entryName : first;
    }

    private static RawNode toNode(Element activity, String ns) {
        boolean hasRoute = firstChild(activity, ns, ROUTE) != null;
        boolean hasImplementation = firstChild(activity, ns, IMPLEMENTATION) != null;

        NodeKind kind;
        if (hasRoute) {
            kind = NodeKind.GATEWAY;
        } else if (hasImplementation) {
            kind = NodeKind.TASK;
        } else {
            kind = NodeKind.GENERIC_ACTIVITY;
        }

        return new RawNode(activity.getAttribute("Id"), normalizeLabel(activity.getAttribute("Name")), kind,
                hasImplementation);
    }

    /**
     * Collapses every run of whitespace (newlines included) to one space and trims.
     *
     * @param s raw label, may be null
     * @return the normalized label, never null
     */
    public static String normalizeLabel(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        return s.replaceAll("\\s+", " ").trim();
    }

    // All descendants of root (root excluded) with the given namespace and local name, in document order.
    static List<Element> descendants(Element root, String ns, String localName) {
        List<Element> found = new ArrayList<>();
        collect(root, ns, localName, found);
        return found;
    }

    private static void collect(Element parent, String ns, String localName, List<Element> found) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() != Node.ELEMENT_NODE) continue;

            Element element = (Element) child;
            if (matches(element, ns, localName)) {
                found.add(element);
            }
            collect(element, ns, localName, found);
        }
    }

    private static Element firstChild(Element parent, String ns, String localName) {
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE && matches((Element) child, ns, localName)) {
                return (Element) child;
            }
        }
        return null;
    }

    private static boolean matches(Element element, String ns, String localName) {
        return localName.equals(element.getLocalName()) && Objects.equals(ns, element.getNamespaceURI());
    }
}
