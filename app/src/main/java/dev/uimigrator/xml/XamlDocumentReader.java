package dev.uimigrator.xml;

import dev.uimigrator.diagnostics.SourceLocation;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.model.XamlNamespaces;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Reads XAML into a {@link UnifiedDocument}. The DOM built on the way becomes the structural layer;
 * every DOM element carries its start line and column as user data, and every unified element keeps
 * a reference to its DOM element.
 *
 * <p>{@code x:Name} and {@code x:Key} become element fields. Other attributes become properties;
 * values in braces are parsed as markup extensions, values starting with {@code {}} are literal.
 * Property elements such as {@code Button.Content} become properties too.
 */
public class XamlDocumentReader {

    public static final String LINE_KEY = "uimigrator.line";
    public static final String COLUMN_KEY = "uimigrator.column";

    private static final Logger LOGGER = LoggerFactory.getLogger(XamlDocumentReader.class);

    private final MarkupExtensionParser extensionParser = new MarkupExtensionParser();

    public UnifiedDocument read(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new MarkupParseException("Failed to read " + file + ": " + ex.getMessage(), -1, -1, ex);
        }
        return read(content, file.toString());
    }

    public UnifiedDocument read(String content, String sourceId) {
        Document dom = parseDom(content, sourceId);
        UnifiedDocument document = new UnifiedDocument(sourceId);
        document.setStructuralLayer(dom);
        Element rootElement = dom.getDocumentElement();
        if (rootElement == null) {
            return document;
        }
        NamedNodeMap attributes = rootElement.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attribute.getNamespaceURI())) {
                String prefix = XMLConstants.XMLNS_ATTRIBUTE.equals(attribute.getName()) ? "" : attribute.getLocalName();
                document.declareNamespace(prefix, attribute.getValue());
            }
        }
        document.setRoot(convert(rootElement, sourceId));
        LOGGER.debug("Read {} with {} element(s)", sourceId, document.elements().size());
        return document;
    }

    private MarkupElement convert(Element domElement, String sourceId) {
        MarkupElement element = new MarkupElement(localName(domElement), domElement.getNamespaceURI());
        element.setStructuralAnchor(domElement);
        element.setLocation(locationOf(domElement, sourceId));

        NamedNodeMap attributes = domElement.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attribute = (Attr) attributes.item(i);
            String namespace = attribute.getNamespaceURI();
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(namespace)) {
                continue;
            }
            if (XamlNamespaces.XAML.equals(namespace) && "Name".equals(attribute.getLocalName())) {
                element.setName(attribute.getValue());
            } else if (XamlNamespaces.XAML.equals(namespace) && "Key".equals(attribute.getLocalName())) {
                element.setKey(attribute.getValue());
            } else {
                MarkupProperty property = toProperty(attribute.getName(), attribute.getValue(), sourceId);
                property.setLocation(element.location().orElse(null));
                element.addProperty(property);
            }
        }

        StringBuilder text = new StringBuilder();
        NodeList children = domElement.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                Element childElement = (Element) child;
                if (localName(childElement).indexOf('.') > 0) {
                    element.addProperty(toPropertyElement(element, childElement, sourceId));
                } else {
                    element.addChild(convert(childElement, sourceId));
                }
            } else if (isText(child)) {
                text.append(child.getNodeValue());
            }
        }
        String content = text.toString().trim();
        if (!content.isEmpty()) {
            element.setTextContent(content);
        }
        return element;
    }

    /**
     * {@code <Owner.Property>} content becomes the value of a property. A single element is the value
     * itself, several elements are held by a collection element named after the tag, and plain text is
     * read like an attribute value. The property is named by its local part when the owner is the
     * enclosing element's type, otherwise it keeps the owner prefix as an attached property.
     */
    private MarkupProperty toPropertyElement(MarkupElement owner, Element domProperty, String sourceId) {
        String tag = localName(domProperty);
        int dot = tag.lastIndexOf('.');
        String propertyName = tag.substring(0, dot).equals(owner.typeName()) ? tag.substring(dot + 1) : tag;
        SourceLocation location = locationOf(domProperty, sourceId);

        List<Element> items = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        NodeList nodes = domProperty.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                items.add((Element) node);
            } else if (isText(node)) {
                text.append(node.getNodeValue());
            }
        }
        String content = text.toString().trim();

        MarkupProperty property;
        if (items.size() == 1 && content.isEmpty()) {
            property = MarkupProperty.element(propertyName, convert(items.get(0), sourceId));
        } else if (items.isEmpty() && !content.isEmpty()) {
            property = toProperty(propertyName, content, sourceId);
        } else {
            MarkupElement collection = new MarkupElement(tag, domProperty.getNamespaceURI());
            collection.setStructuralAnchor(domProperty);
            collection.setLocation(location);
            for (Element item : items) {
                collection.addChild(convert(item, sourceId));
            }
            if (!content.isEmpty()) {
                collection.setTextContent(content);
            }
            property = MarkupProperty.element(propertyName, collection);
        }
        property.setLocation(location);
        return property;
    }

    private static boolean isText(Node node) {
        return node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE;
    }

    private MarkupProperty toProperty(String name, String value, String sourceId) {
        if (value.startsWith("{}")) {
            return MarkupProperty.literal(name, value.substring(2));
        }
        if (MarkupExtensionParser.isMarkupExtension(value)) {
            try {
                return MarkupProperty.extension(name, extensionParser.parse(value.trim()));
            } catch (MarkupParseException ex) {
                LOGGER.warn("{}: keeping {} as literal text: {}", sourceId, name, ex.getMessage());
            }
        }
        return MarkupProperty.literal(name, value);
    }

    private static String localName(Element element) {
        return element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    }

    private static SourceLocation locationOf(Element element, String sourceId) {
        Object line = element.getUserData(LINE_KEY);
        Object column = element.getUserData(COLUMN_KEY);
        if (line instanceof Integer lineNumber && column instanceof Integer columnNumber) {
            return SourceLocation.of(sourceId, lineNumber, columnNumber);
        }
        return SourceLocation.fileOnly(sourceId);
    }

    private static Document parseDom(String content, String sourceId) {
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            SAXParser parser = factory.newSAXParser();
            Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            parser.parse(new InputSource(new StringReader(content)), new DomBuildingHandler(document));
            return document;
        } catch (SAXParseException ex) {
            throw new MarkupParseException(sourceId + ":" + ex.getLineNumber() + ":" + ex.getColumnNumber() + ": " + ex.getMessage(),
                    ex.getLineNumber(), ex.getColumnNumber(), ex);
        } catch (SAXException | ParserConfigurationException | IOException ex) {
            throw new MarkupParseException("Failed to parse " + sourceId + ": " + ex.getMessage(), -1, -1, ex);
        }
    }

    /**
     * Builds a namespace-aware DOM from SAX events, recording where each element starts.
     */
    private static final class DomBuildingHandler extends DefaultHandler {

        private final Document document;
        private final Deque<Node> open = new ArrayDeque<>();
        private final Map<String, String> pendingNamespaces = new LinkedHashMap<>();
        private Locator locator;

        DomBuildingHandler(Document document) {
            this.document = document;
            open.push(document);
        }

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startPrefixMapping(String prefix, String uri) {
            pendingNamespaces.put(prefix, uri);
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            Element element = document.createElementNS(uri == null || uri.isEmpty() ? null : uri, qName);
            pendingNamespaces.forEach((prefix, namespace) -> element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI,
                    prefix.isEmpty() ? XMLConstants.XMLNS_ATTRIBUTE : XMLConstants.XMLNS_ATTRIBUTE + ":" + prefix, namespace));
            pendingNamespaces.clear();
            for (int i = 0; i < attributes.getLength(); i++) {
                String attributeUri = attributes.getURI(i);
                element.setAttributeNS(attributeUri == null || attributeUri.isEmpty() ? null : attributeUri,
                        attributes.getQName(i), attributes.getValue(i));
            }
            if (locator != null) {
                element.setUserData(LINE_KEY, locator.getLineNumber(), null);
                element.setUserData(COLUMN_KEY, locator.getColumnNumber(), null);
            }
            open.peek().appendChild(element);
            open.push(element);
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            open.pop();
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            Node current = open.peek();
            if (current != document) {
                current.appendChild(document.createTextNode(new String(ch, start, length)));
            }
        }
    }
}
