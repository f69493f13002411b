package com.queryguard.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

/**
 * GraphQL 变量值的类型化表示。
 * <p>
 * 调用方传入的变量是松散的 Map / List / 标量组合（通常由 Jackson 反序列化而来）。
 * {@link #of(Object)} 只对当前这一层分类，不复制也不递归转换子元素：
 * 校验器先检查容器大小和嵌套层数，再对子元素逐个调用 {@code of}。
 * 无法识别的 Java 类型转换为 {@link UnsupportedValue}，由校验器按路径报错。
 */
public interface VariableNode {

    static VariableNode of(Object value) {
        if (value == null) {
            return NullValue.INSTANCE;
        }
        if (value instanceof CharSequence text) {
            return new StringValue(text.toString());
        }
        if (value instanceof Boolean bool) {
            return new BooleanValue(bool);
        }
        if (value instanceof Number number) {
            return new NumberValue(number);
        }
        if (value instanceof Map<?, ?> map) {
            return new MapValue(map);
        }
        if (value instanceof Collection<?> collection) {
            return new ListValue(collection);
        }
        if (value instanceof Object[] array) {
            return new ListValue(Arrays.asList(array));
        }
        return new UnsupportedValue(value.getClass().getSimpleName());
    }

    enum NullValue implements VariableNode {
        INSTANCE
    }

    record StringValue(String value) implements VariableNode {
    }

    record NumberValue(Number value) implements VariableNode {
    }

    record BooleanValue(boolean value) implements VariableNode {
    }

    /**
     * @param items 原始元素，未转换
     */
    record ListValue(Collection<?> items) implements VariableNode {
    }

    /**
     * @param entries 原始键值，未转换；键按 {@link String#valueOf(Object)} 参与路径
     */
    record MapValue(Map<?, ?> entries) implements VariableNode {
    }

    record UnsupportedValue(String typeName) implements VariableNode {
    }
}
