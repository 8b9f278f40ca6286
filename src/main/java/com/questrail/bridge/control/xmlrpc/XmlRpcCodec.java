package com.questrail.bridge.control.xmlrpc;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * XmlRpcCodec
 * -----------------------------------------------------------------------------
 * Encodes {@code methodCall} documents and decodes {@code methodResponse}
 * documents for the daemon's control interface.
 *
 * <h2>Value mapping</h2>
 * <table>
 *   <caption>XML-RPC to Java</caption>
 *   <tr><td>{@code string} (or untyped)</td><td>{@link String}</td></tr>
 *   <tr><td>{@code int}, {@code i4}</td><td>{@link Integer}</td></tr>
 *   <tr><td>{@code i8}</td><td>{@link Long}</td></tr>
 *   <tr><td>{@code boolean}</td><td>{@link Boolean}</td></tr>
 *   <tr><td>{@code double}</td><td>{@link Double}</td></tr>
 *   <tr><td>{@code array}</td><td>{@link List}</td></tr>
 *   <tr><td>{@code struct}</td><td>{@link Map} with insertion order</td></tr>
 *   <tr><td>{@code base64}</td><td>{@code byte[]}</td></tr>
 *   <tr><td>{@code dateTime.iso8601}</td><td>{@link String}, verbatim</td></tr>
 *   <tr><td>{@code nil}</td><td>{@code null}</td></tr>
 * </table>
 *
 * <p>The codec is stateless. DTDs and external entities are refused.</p>
 */
public final class XmlRpcCodec
{
    private XmlRpcCodec() {}

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    public static byte[] encodeCall(String method, List<?> params)
    {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");

        StringBuilder sb = new StringBuilder(256);
        sb.append("<?xml version=\"1.0\"?>\n<methodCall><methodName>")
                .append(escape(method))
                .append("</methodName><params>");
        for (Object param : params) {
            sb.append("<param>");
            appendValue(sb, param);
            sb.append("</param>");
        }
        sb.append("</params></methodCall>\n");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static void appendValue(StringBuilder sb, Object value)
    {
        sb.append("<value>");
        if (value == null) {
            sb.append("<nil/>");
        } else if (value instanceof String s) {
            sb.append("<string>").append(escape(s)).append("</string>");
        } else if (value instanceof Boolean b) {
            sb.append("<boolean>").append(b ? '1' : '0').append("</boolean>");
        } else if (value instanceof Integer i) {
            sb.append("<int>").append(i).append("</int>");
        } else if (value instanceof Long l) {
            sb.append("<i8>").append(l).append("</i8>");
        } else if (value instanceof Double d) {
            sb.append("<double>").append(d).append("</double>");
        } else if (value instanceof byte[] bytes) {
            sb.append("<base64>").append(Base64.getEncoder().encodeToString(bytes)).append("</base64>");
        } else if (value instanceof List<?> list) {
            sb.append("<array><data>");
            for (Object item : list) {
                appendValue(sb, item);
            }
            sb.append("</data></array>");
        } else if (value instanceof Map<?, ?> map) {
            sb.append("<struct>");
            for (Map.Entry<?, ?> e : map.entrySet()) {
                sb.append("<member><name>").append(escape(String.valueOf(e.getKey()))).append("</name>");
                appendValue(sb, e.getValue());
                sb.append("</member>");
            }
            sb.append("</struct>");
        } else {
            throw new IllegalArgumentException("Unsupported XML-RPC parameter type " + value.getClass().getName());
        }
        sb.append("</value>");
    }

    static String escape(String s)
    {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    // ---------------------------------------------------------------------
    // Decoding
    // ---------------------------------------------------------------------

    /**
     * Decodes a {@code methodResponse}.
     *
     * @return the single returned value, mapped per the class table
     * @throws XmlRpcFault           if the response is a fault
     * @throws XmlRpcFormatException if the document is not a valid response
     */
    public static Object decodeResponse(byte[] body) throws XmlRpcFault, XmlRpcFormatException
    {
        Objects.requireNonNull(body, "body");
        Element root = parse(body).getDocumentElement();
        if (!"methodResponse".equals(root.getTagName())) {
            throw new XmlRpcFormatException("Expected methodResponse, got " + root.getTagName());
        }

        Element first = firstChild(root, "methodResponse");
        switch (first.getTagName()) {
            case "fault" -> throw toFault(decodeValue(requireChild(first, "value")));
            case "params" -> {
                Element param = requireChild(first, "param");
                return decodeValue(requireChild(param, "value"));
            }
            default -> throw new XmlRpcFormatException("Unexpected element <" + first.getTagName() + ">");
        }
    }

    private static XmlRpcFault toFault(Object value) throws XmlRpcFormatException
    {
        if (!(value instanceof Map<?, ?> map)) {
            throw new XmlRpcFormatException("Fault value is not a struct");
        }
        Object code = map.get("faultCode");
        Object text = map.get("faultString");
        if (!(code instanceof Integer c)) {
            throw new XmlRpcFormatException("Fault has no integer faultCode");
        }
        return new XmlRpcFault(c, text == null ? "" : text.toString());
    }

    private static Object decodeValue(Element value) throws XmlRpcFormatException
    {
        List<Element> children = elements(value);
        if (children.isEmpty()) {
            return value.getTextContent();
        }

        Element typed = children.get(0);
        String text = typed.getTextContent().trim();
        try {
            return switch (typed.getTagName()) {
                case "string" -> typed.getTextContent();
                case "int", "i4" -> Integer.parseInt(text);
                case "i8" -> Long.parseLong(text);
                case "boolean" -> decodeBoolean(text);
                case "double" -> Double.parseDouble(text);
                case "dateTime.iso8601" -> text;
                case "base64" -> Base64.getMimeDecoder().decode(text);
                case "nil" -> null;
                case "array" -> decodeArray(typed);
                case "struct" -> decodeStruct(typed);
                default -> throw new XmlRpcFormatException("Unknown value type <" + typed.getTagName() + ">");
            };
        } catch (NumberFormatException e) {
            throw new XmlRpcFormatException("Bad numeric value '" + text + "'", e);
        } catch (IllegalArgumentException e) {
            throw new XmlRpcFormatException("Bad value in <" + typed.getTagName() + ">", e);
        }
    }

    private static Boolean decodeBoolean(String text) throws XmlRpcFormatException
    {
        return switch (text) {
            case "1" -> Boolean.TRUE;
            case "0" -> Boolean.FALSE;
            default -> throw new XmlRpcFormatException("Bad boolean value '" + text + "'");
        };
    }

    private static List<Object> decodeArray(Element array) throws XmlRpcFormatException
    {
        Element data = requireChild(array, "data");
        List<Object> items = new ArrayList<>();
        for (Element v : elements(data)) {
            if (!"value".equals(v.getTagName())) {
                throw new XmlRpcFormatException("Unexpected <" + v.getTagName() + "> in array");
            }
            items.add(decodeValue(v));
        }
        return items;
    }

    private static Map<String, Object> decodeStruct(Element struct) throws XmlRpcFormatException
    {
        Map<String, Object> members = new LinkedHashMap<>();
        for (Element member : elements(struct)) {
            if (!"member".equals(member.getTagName())) {
                throw new XmlRpcFormatException("Unexpected <" + member.getTagName() + "> in struct");
            }
            String name = requireChild(member, "name").getTextContent();
            members.put(name, decodeValue(requireChild(member, "value")));
        }
        return members;
    }

    // ---------------------------------------------------------------------
    // DOM helpers
    // ---------------------------------------------------------------------

    private static Document parse(byte[] body) throws XmlRpcFormatException
    {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(null);
            return builder.parse(new ByteArrayInputStream(body));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        } catch (SAXException | IOException e) {
            throw new XmlRpcFormatException("Malformed XML-RPC response", e);
        }
    }

    private static List<Element> elements(Element parent)
    {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static Element firstChild(Element parent, String what) throws XmlRpcFormatException
    {
        List<Element> children = elements(parent);
        if (children.isEmpty()) {
            throw new XmlRpcFormatException("Empty <" + what + ">");
        }
        return children.get(0);
    }

    private static Element requireChild(Element parent, String tag) throws XmlRpcFormatException
    {
        for (Element e : elements(parent)) {
            if (tag.equals(e.getTagName())) {
                return e;
            }
        }
        throw new XmlRpcFormatException("<" + parent.getTagName() + "> has no <" + tag + ">");
    }
}
