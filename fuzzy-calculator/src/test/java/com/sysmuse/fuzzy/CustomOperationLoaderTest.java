package com.sysmuse.fuzzy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.fuzzy.binding.BindingTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CustomOperationLoaderTest {

    private ExpressionManager manager;
    private ObjectMapper mapper;

    @BeforeEach
    public void setup() {
        manager = new ExpressionManager();
        mapper = new ObjectMapper();
    }

    @Test
    public void testLoadAndExecuteCustomOperationsFromJson() throws Exception {
        List<CustomOperation> ops;
        try (InputStream in = getClass().getResourceAsStream("/custom_operations_test.json")) {
            assertNotNull(in);
            ops = CustomOperationLoader.load(in, manager);
        }

        assertEquals(3, ops.size());
        assertEquals("par", ops.get(0).getName());
        assertFalse(ops.get(0).isInfix());
        assertTrue(ops.get(2).isInfix());
        assertEquals(2, ops.get(2).getPriority());

        OperationRegistry registry = manager.getRegistry();
        assertTrue(registry.isFunction("par"));
        assertTrue(registry.isFunction("divider"));
        assertTrue(registry.isInfix("||"));

        BindingTable table = new BindingTable()
                .put("R1", 4, "k")
                .put("R2", 12, "k")
                .put("V", 12);
        assertEquals(3000.0, manager.evaluate("par(R1, R2)", table), 1e-9);
        assertEquals(9.0, manager.evaluate("divider(V, R1, R2)", table), 1e-9);
        assertEquals(3000.0, manager.evaluate("R1 || R2", table), 1e-9);
        assertEquals(3001.0, manager.evaluate("R1 || R2 + 1", table), 1e-9);
    }

    @Test
    public void testSingleObject() throws Exception {
        JsonNode node = mapper.readTree("{\"name\": \"sq\", \"args\": [\"v\"], \"expression\": \"v^2\"}");
        List<CustomOperation> ops = CustomOperationLoader.fromJson(node, manager);
        assertEquals(1, ops.size());
        assertFalse(manager.getRegistry().isFunction("sq"));

        manager.register(ops.get(0));
        assertEquals(9.0, manager.evaluate("sq(3)", name -> 0), 1e-12);
        assertEquals(-9.0, manager.evaluate("-sq(3)", name -> 0), 1e-12);
    }

    @Test
    public void testBodyIsEvaluatedWithItsOwnArguments() {
        CustomOperation twice = CustomOperation.function("twice", List.of("x"), "2x", manager);
        manager.register(twice);
        assertEquals(6.0, twice.apply(3.0), 1e-12);
        // the caller's x does not leak into the body
        assertEquals(10.0, manager.evaluate("twice(5)", name -> 100), 1e-12);
        assertEquals("twice(x) = 2x", twice.toString());
    }

    @Test
    public void testLaterOperationsUseEarlierOnes() throws Exception {
        JsonNode node = mapper.readTree("["
                + "{\"name\": \"sq\", \"args\": [\"v\"], \"expression\": \"v^2\"},"
                + "{\"name\": \"hyp\", \"args\": [\"a\", \"b\"], \"expression\": \"sqrt(sq(a) + sq(b))\"}"
                + "]");
        CustomOperationLoader.loadAndRegister(node, manager);
        assertEquals(5.0, manager.evaluate("hyp(3, 4)", name -> 0), 1e-12);
    }

    @Test
    public void testFreeVariableInBody() {
        SyntaxException e = assertThrows(SyntaxException.class,
                () -> CustomOperation.function("gain", List.of("x"), "x*k", manager));
        assertTrue(e.getMessage().contains("k"));
    }

    @Test
    public void testSelfReferenceIsRejected() {
        // not yet registered, so "loop" reads as a free variable
        assertThrows(SyntaxException.class,
                () -> CustomOperation.function("loop", List.of("x"), "loop(x)", manager));
    }

    @Test
    public void testInvalidDefinitions() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> CustomOperation.function("f", List.of("pi"), "pi", manager));
        assertThrows(IllegalArgumentException.class,
                () -> CustomOperation.function("f", List.of("a", "a"), "a", manager));
        assertThrows(IllegalArgumentException.class,
                () -> CustomOperation.infix("@", 2, List.of("a"), "a", manager));

        JsonNode missingArgs = mapper.readTree("{\"name\": \"f\", \"expression\": \"1\"}");
        assertThrows(IllegalArgumentException.class, () -> CustomOperationLoader.fromJson(missingArgs, manager));

        JsonNode missingName = mapper.readTree("{\"args\": [\"x\"], \"expression\": \"x\"}");
        assertThrows(IllegalArgumentException.class, () -> CustomOperationLoader.fromJson(missingName, manager));
    }

    @Test
    public void testArityIsCheckedAtParseTime() {
        manager.register(CustomOperation.function("par", List.of("a", "b"), "a*b/(a+b)", manager));
        assertThrows(ArityMismatchException.class, () -> manager.parse("par(1)"));
    }

    @Test
    public void testNullOrMissingIsEmpty() {
        assertTrue(CustomOperationLoader.fromJson(null, manager).isEmpty());
        assertTrue(CustomOperationLoader.fromJson(mapper.createObjectNode().path("none"), manager).isEmpty());
    }
}
