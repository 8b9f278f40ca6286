package com.questrail.bridge.control.xmlrpc;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class XmlRpcCodecTest {

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void encodesMethodCallWithEscapedStringParameter() {
        String xml = new String(XmlRpcCodec.encodeCall("supervisor.startProcess", List.of("web:<api>&1")),
                StandardCharsets.UTF_8);

        assertTrue(xml.startsWith("<?xml version=\"1.0\"?>"));
        assertTrue(xml.contains("<methodName>supervisor.startProcess</methodName>"));
        assertTrue(xml.contains("<param><value><string>web:&lt;api&gt;&amp;1</string></value></param>"));
    }

    @Test
    void encodesScalarsAndContainers() {
        String xml = new String(XmlRpcCodec.encodeCall("m",
                List.of(true, 7, 9_000_000_000L, List.of("a"), Map.of("k", 1))), StandardCharsets.UTF_8);

        assertTrue(xml.contains("<boolean>1</boolean>"));
        assertTrue(xml.contains("<int>7</int>"));
        assertTrue(xml.contains("<i8>9000000000</i8>"));
        assertTrue(xml.contains("<array><data><value><string>a</string></value></data></array>"));
        assertTrue(xml.contains("<struct><member><name>k</name><value><int>1</int></value></member></struct>"));
    }

    @Test
    void rejectsUnsupportedParameterType() {
        assertThrows(IllegalArgumentException.class,
                () -> XmlRpcCodec.encodeCall("m", List.of(new Object())));
    }

    @Test
    void decodesProcessInfoArray() throws Exception {
        Object value = XmlRpcCodec.decodeResponse(XmlRpcResponses.success(List.of(
                XmlRpcResponses.processInfo("web", "api", "RUNNING", 101),
                XmlRpcResponses.processInfo("db", "db", "FATAL", 0))));

        List<?> rows = assertInstanceOf(List.class, value);
        assertEquals(2, rows.size());
        Map<?, ?> first = assertInstanceOf(Map.class, rows.get(0));
        assertEquals("api", first.get("name"));
        assertEquals("RUNNING", first.get("statename"));
        assertEquals(101, first.get("pid"));
    }

    @Test
    void valueWithoutTypeIsString() throws Exception {
        Object value = XmlRpcCodec.decodeResponse(bytes(
                "<methodResponse><params><param><value>plain text</value></param></params></methodResponse>"));
        assertEquals("plain text", value);
    }

    @Test
    void decodesBooleanAndNil() throws Exception {
        assertEquals(Boolean.TRUE, XmlRpcCodec.decodeResponse(XmlRpcResponses.success(true)));
        assertNull(XmlRpcCodec.decodeResponse(bytes(
                "<methodResponse><params><param><value><nil/></value></param></params></methodResponse>")));
    }

    @Test
    void faultResponseThrowsWithCodeAndString() {
        XmlRpcFault fault = assertThrows(XmlRpcFault.class,
                () -> XmlRpcCodec.decodeResponse(XmlRpcResponses.fault(XmlRpcFault.BAD_NAME, "BAD_NAME: nope")));

        assertEquals(XmlRpcFault.BAD_NAME, fault.faultCode());
        assertEquals("BAD_NAME: nope", fault.faultString());
    }

    @Test
    void malformedDocumentsAreFormatErrors() {
        assertThrows(XmlRpcFormatException.class, () -> XmlRpcCodec.decodeResponse(bytes("<html>oops</html>")));
        assertThrows(XmlRpcFormatException.class, () -> XmlRpcCodec.decodeResponse(bytes("not xml")));
        assertThrows(XmlRpcFormatException.class, () -> XmlRpcCodec.decodeResponse(bytes(
                "<methodResponse><params><param><value><int>x</int></value></param></params></methodResponse>")));
        assertThrows(XmlRpcFormatException.class, () -> XmlRpcCodec.decodeResponse(bytes(
                "<methodResponse><params><param><value><float>1</float></value></param></params></methodResponse>")));
    }

    @Test
    void doctypeIsRefused() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY e SYSTEM \"file:///etc/passwd\">]>"
                + "<methodResponse><params><param><value>&e;</value></param></params></methodResponse>";
        assertThrows(XmlRpcFormatException.class, () -> XmlRpcCodec.decodeResponse(bytes(xxe)));
    }
}
