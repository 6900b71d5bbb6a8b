package com.tapl.compiler.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 一次编译中已知的全部类型。
 *
 * <p>以关键字（含语法糖别名）为键，保持注册顺序，
 * 保证后续生成的 C 头文件内容稳定。</p>
 */
public class Types {

    private final Map<String, TaplType> types = new LinkedHashMap<>();

    public Types() {
        for (TaplType type : builtinTypes()) {
            for (String keyword : type.getAllKeywords()) {
                if (types.containsKey(keyword)) {
                    throw new IllegalStateException("Duplicate builtin keyword: " + keyword);
                }
                types.put(keyword, type);
            }
        }
    }

    private static List<TaplType> builtinTypes() {
        NumericType u1 = new NumericType("u1", NumericKind.UNSIGNED, 1,
                Collections.singletonList("bool"), "bool");
        NumericType u8 = new NumericType("u8", NumericKind.UNSIGNED, 8, "uint8_t");
        NumericType u16 = new NumericType("u16", NumericKind.UNSIGNED, 16, "uint16_t");
        NumericType u32 = new NumericType("u32", NumericKind.UNSIGNED, 32, "uint32_t");
        NumericType u64 = new NumericType("u64", NumericKind.UNSIGNED, 64, "uint64_t");
        NumericType s8 = new NumericType("s8", NumericKind.SIGNED, 8, "int8_t");
        NumericType s16 = new NumericType("s16", NumericKind.SIGNED, 16, "int16_t");
        NumericType s32 = new NumericType("s32", NumericKind.SIGNED, 32, "int32_t");
        NumericType s64 = new NumericType("s64", NumericKind.SIGNED, 64, "int64_t");
        NumericType f32 = new NumericType("f32", NumericKind.FLOATING_POINT, 32, "float");
        NumericType f64 = new NumericType("f64", NumericKind.FLOATING_POINT, 64, "double");
        // 未确定类型的整数字面量的默认类型
        NumericType base = new NumericType("base", NumericKind.SIGNED, 64, "int64_t");

        u1.addPromotions(u8, u16, u32, u64);
        u8.addPromotions(u16, u32, u64);
        u16.addPromotions(u32, u64);
        u32.addPromotions(u64);
        s8.addPromotions(s16, s32, s64);
        s16.addPromotions(s32, s64);
        s32.addPromotions(s64);
        f32.addPromotions(f64);

        return Arrays.asList(
                new BasicType("void", "void"),
                u1, u8, u16, u32, u64,
                s8, s16, s32, s64,
                f32, f64,
                base,
                new CharacterType(),
                new BasicType("string", "char*"));
    }

    /**
     * 添加类类型，已存在时返回已有的类型。
     */
    public ClassType addClassType(String name) {
        TaplType existing = types.get(name);
        if (existing == null) {
            ClassType classType = new ClassType(name);
            types.put(name, classType);
            return classType;
        }
        if (!(existing instanceof ClassType)) {
            throw new IllegalArgumentException("'" + name + "' is already a " + existing.getClass().getSimpleName());
        }
        return (ClassType) existing;
    }

    /**
     * 添加元素类型为 innerType 的列表类型，已存在时返回已有的类型。
     */
    public ListType addListType(TaplType innerType) {
        String keyword = "list[" + innerType.getKeyword() + "]";
        TaplType existing = types.get(keyword);
        if (existing == null) {
            ListType listType = new ListType(innerType);
            types.put(keyword, listType);
            return listType;
        }
        return (ListType) existing;
    }

    /**
     * 按关键字或别名查找，不存在返回 null。
     */
    public TaplType get(String keyword) {
        return types.get(keyword);
    }

    /**
     * 按关键字或别名查找，不存在时抛出异常。
     */
    public TaplType getType(String keyword) {
        TaplType type = types.get(keyword);
        if (type == null) {
            throw new IllegalArgumentException("Unknown type: " + keyword);
        }
        return type;
    }

    public boolean contains(String keyword) {
        return types.containsKey(keyword);
    }

    /**
     * 所有不同的类型（别名去重），按注册顺序。
     */
    public Collection<TaplType> values() {
        return Collections.unmodifiableCollection(new LinkedHashSet<>(types.values()));
    }

    /**
     * 已注册的全部列表类型，按注册顺序。
     */
    public List<ListType> listTypes() {
        List<ListType> lists = new ArrayList<>();
        for (TaplType type : values()) {
            if (type instanceof ListType) {
                lists.add((ListType) type);
            }
        }
        return lists;
    }
}
