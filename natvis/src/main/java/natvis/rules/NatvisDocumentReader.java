package natvis.rules;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import com.google.common.base.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import natvis.VisualizerId;

/**
 * Reads natvis XML (`<AutoVisualizer>` documents). Elements are matched by local name, so documents
 * with or without the `http://schemas.microsoft.com/vstudio/debugger/natvis/2010` namespace both work.
 *
 * Malformed items are dropped with a warning; only a document that can't be read at all is an error.
 * Type names are not parsed here, that happens when the document is registered.
 */
public class NatvisDocumentReader {
    private static final Logger LOG = LoggerFactory.getLogger(NatvisDocumentReader.class);

    private final DocumentBuilderFactory factory;

    public NatvisDocumentReader() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setIgnoringComments(true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            // rule files never need a DTD, and a DTD is how external entities get in
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        }
        catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
    }

    public NatvisDocument read(InputStream in, String origin) throws IOException {
        final org.w3c.dom.Document doc;
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new DefaultHandler()); // fatal errors throw, no stderr noise
            doc = builder.parse(in);
        }
        catch (ParserConfigurationException e) {
            throw new IllegalStateException(e);
        }
        catch (SAXException e) {
            throw new NatvisDocumentException("'" + origin + "' is not well formed: " + e.getMessage(), e);
        }

        final Element root = doc.getDocumentElement();
        if (!"AutoVisualizer".equals(localName(root))) {
            throw new NatvisDocumentException("'" + origin + "' has root element <" + localName(root) + ">, expected <AutoVisualizer>");
        }

        final var types = new ArrayList<VisualizerDefinition>();
        final var aliases = new ArrayList<AliasDefinition>();
        final var uiVisualizers = new ArrayList<UiVisualizerRegistration>();

        for (var e : childElements(root)) {
            switch (localName(e)) {
                case "Type": {
                    final var type = maybeNull_readType(e, origin);
                    if (type != null) {
                        types.add(type);
                    }
                    break;
                }
                case "Alias": {
                    final var name = attr(e, "Name");
                    var value = attr(e, "Value");
                    if (isBlank(value)) {
                        value = text(e);
                    }
                    if (isBlank(name) || isBlank(value)) {
                        LOG.warn("{}: skipping <Alias> without Name or Value", origin);
                    }
                    else {
                        aliases.add(new AliasDefinition(name, value.trim()));
                    }
                    break;
                }
                case "UIVisualizer": {
                    final var id = maybeNull_readUiVisualizerId(e, origin);
                    if (id != null) {
                        uiVisualizers.add(new UiVisualizerRegistration(id.serviceId, id.id, Strings.nullToEmpty(attr(e, "MenuName"))));
                    }
                    break;
                }
                default:
                    // e.g. <Version>, <HResult>, <Intrinsic> aren't supported
                    break;
            }
        }

        return new NatvisDocument(origin, types, aliases, uiVisualizers);
    }

    private VisualizerDefinition maybeNull_readType(Element type, String origin) {
        final var name = attr(type, "Name");
        if (isBlank(name)) {
            LOG.warn("{}: skipping <Type> without a Name", origin);
            return null;
        }

        final var alternativeTypes = new ArrayList<String>();
        final var displayStrings = new ArrayList<DisplayStringRule>();
        final var uiVisualizers = new ArrayList<VisualizerId>();
        List<ExpandRule> expandRules = null;

        for (var e : childElements(type)) {
            switch (localName(e)) {
                case "AlternativeType": {
                    final var altName = attr(e, "Name");
                    if (!isBlank(altName)) {
                        alternativeTypes.add(altName);
                    }
                    break;
                }
                case "DisplayString":
                    displayStrings.add(new DisplayStringRule(e.getTextContent(), attr(e, "Condition")));
                    break;
                case "UIVisualizer": {
                    final var id = maybeNull_readUiVisualizerId(e, origin);
                    if (id != null) {
                        uiVisualizers.add(id);
                    }
                    break;
                }
                case "Expand":
                    if (expandRules != null) {
                        LOG.warn("{}: <Type Name=\"{}\"> has more than one <Expand>, ignoring all but the first", origin, name);
                    }
                    else {
                        expandRules = readExpand(e, name, origin);
                    }
                    break;
                default:
                    break;
            }
        }

        return new VisualizerDefinition(name, alternativeTypes, displayStrings, expandRules, uiVisualizers);
    }

    private List<ExpandRule> readExpand(Element expand, String typeName, String origin) {
        final var result = new ArrayList<ExpandRule>();
        for (var e : childElements(expand)) {
            final var condition = attr(e, "Condition");
            switch (localName(e)) {
                case "Item": {
                    final var value = text(e);
                    if (isBlank(value)) {
                        LOG.warn("{}: skipping empty <Item> in <Type Name=\"{}\">", origin, typeName);
                    }
                    else {
                        result.add(new ExpandRule.Item(attr(e, "Name"), value, condition));
                    }
                    break;
                }
                case "ArrayItems": {
                    final var size = childText(e, "Size");
                    final var valuePointers = conditionalChildren(e, "ValuePointer");
                    if (isBlank(size) || valuePointers.isEmpty()) {
                        LOG.warn("{}: skipping <ArrayItems> without <Size> or <ValuePointer> in <Type Name=\"{}\">", origin, typeName);
                    }
                    else {
                        result.add(new ExpandRule.ArrayItems(size, valuePointers, condition));
                    }
                    break;
                }
                case "TreeItems": {
                    final var valueNodes = conditionalChildren(e, "ValueNode");
                    result.add(new ExpandRule.TreeItems(
                        childText(e, "Size"),
                        childText(e, "HeadPointer"),
                        childText(e, "LeftPointer"),
                        childText(e, "RightPointer"),
                        valueNodes.isEmpty() ? null : valueNodes.get(0),
                        condition
                    ));
                    break;
                }
                case "LinkedListItems": {
                    final var noValueHeadPointer = childText(e, "NoValueHeadPointer");
                    result.add(new ExpandRule.LinkedListItems(
                        childText(e, "Size"),
                        childText(e, "HeadPointer"),
                        childText(e, "NextPointer"),
                        childText(e, "ValueNode"),
                        noValueHeadPointer != null && (noValueHeadPointer.equalsIgnoreCase("true") || noValueHeadPointer.equals("1")),
                        condition
                    ));
                    break;
                }
                case "IndexListItems":
                    result.add(new ExpandRule.IndexListItems(
                        conditionalChildren(e, "Size"),
                        conditionalChildren(e, "ValueNode"),
                        condition
                    ));
                    break;
                case "ExpandedItem": {
                    final var value = text(e);
                    if (isBlank(value)) {
                        LOG.warn("{}: skipping empty <ExpandedItem> in <Type Name=\"{}\">", origin, typeName);
                    }
                    else {
                        result.add(new ExpandRule.ExpandedItem(value, condition));
                    }
                    break;
                }
                default:
                    // <Synthetic>, <CustomListItems> aren't supported
                    break;
            }
        }
        return result;
    }

    private static VisualizerId maybeNull_readUiVisualizerId(Element e, String origin) {
        final var serviceId = attr(e, "ServiceId");
        final var id = attr(e, "Id");
        if (isBlank(serviceId) || isBlank(id)) {
            LOG.warn("{}: skipping <UIVisualizer> without ServiceId or Id", origin);
            return null;
        }
        try {
            return new VisualizerId(serviceId, Integer.parseInt(id.trim()));
        }
        catch (NumberFormatException ex) {
            LOG.warn("{}: skipping <UIVisualizer> with non-numeric Id '{}'", origin, id);
            return null;
        }
    }

    private static List<ConditionalExpression> conditionalChildren(Element parent, String name) {
        final var result = new ArrayList<ConditionalExpression>();
        for (var e : childElements(parent)) {
            if (name.equals(localName(e))) {
                final var value = text(e);
                if (!isBlank(value)) {
                    result.add(new ConditionalExpression(value, attr(e, "Condition")));
                }
            }
        }
        return result;
    }

    /**
     * @return String | null if there is no such child
     */
    private static String childText(Element parent, String name) {
        for (var e : childElements(parent)) {
            if (name.equals(localName(e))) {
                return text(e);
            }
        }
        return null;
    }

    private static List<Element> childElements(Element parent) {
        final var result = new ArrayList<Element>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element)n);
            }
        }
        return result;
    }

    private static String localName(Element e) {
        return e.getLocalName() != null ? e.getLocalName() : e.getTagName();
    }

    /**
     * @return String | null if the attribute isn't present
     */
    private static String attr(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    private static String text(Element e) {
        return e.getTextContent().trim();
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
