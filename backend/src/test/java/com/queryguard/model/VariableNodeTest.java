package com.queryguard.model;

import com.queryguard.model.VariableNode.BooleanValue;
import com.queryguard.model.VariableNode.ListValue;
import com.queryguard.model.VariableNode.MapValue;
import com.queryguard.model.VariableNode.NullValue;
import com.queryguard.model.VariableNode.NumberValue;
import com.queryguard.model.VariableNode.StringValue;
import com.queryguard.model.VariableNode.UnsupportedValue;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VariableNodeTest {

    @Test
    void shouldConvertScalars() {
        assertSame(NullValue.INSTANCE, VariableNode.of(null));
        assertEquals(new StringValue("abc"), VariableNode.of(new StringBuilder("abc")));
        assertEquals(new BooleanValue(true), VariableNode.of(Boolean.TRUE));
        assertEquals(new NumberValue(1.5), VariableNode.of(1.5));
    }

    @Test
    void shouldClassifyOnlyTheOuterLevel() {
        List<Object> items = List.of("a", 2);
        Map<String, Object> filter = Map.of("items", items);

        MapValue map = assertInstanceOf(MapValue.class, VariableNode.of(filter));
        assertSame(filter, map.entries());
        assertSame(items, map.entries().get("items"));

        ListValue list = assertInstanceOf(ListValue.class, VariableNode.of(map.entries().get("items")));
        assertSame(items, list.items());
    }

    @Test
    void shouldWrapObjectArrayButNotPrimitiveArray() {
        ListValue list = assertInstanceOf(ListValue.class, VariableNode.of(new String[]{"a", "b"}));
        assertEquals(List.of("a", "b"), List.copyOf(list.items()));
        assertEquals(new UnsupportedValue("int[]"), VariableNode.of(new int[]{1}));
    }

    @Test
    void shouldMarkUnknownTypesAsUnsupported() {
        assertEquals(new UnsupportedValue("LocalDate"), VariableNode.of(LocalDate.of(2024, 1, 1)));
    }
}
