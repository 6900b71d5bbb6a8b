package com.tapl.codegen.lowering;

import com.tapl.codegen.InternalCompilerError;
import com.tapl.compiler.types.TaplType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次编译内的列表实例表。
 *
 * <p>以元素类型关键字为键，保持注册顺序（即 C 输出顺序）。
 * 同时检查定义名唯一，两个不同元素类型得到相同名字属于内部错误。</p>
 */
public class MonomorphizationRegistry {

    /** 元素类型关键字 → 实例 */
    private final Map<String, ListInstantiation> byElementType = new LinkedHashMap<>();
    /** 定义名 → 元素类型关键字 */
    private final Map<String, String> byDefinitionName = new HashMap<>();

    /**
     * 查找已有实例，不存在返回 null。
     */
    public ListInstantiation lookup(TaplType elementType) {
        return byElementType.get(elementType.getKeyword());
    }

    public boolean contains(TaplType elementType) {
        return byElementType.containsKey(elementType.getKeyword());
    }

    /**
     * 登记新实例。
     *
     * @throws InternalCompilerError 元素类型已登记，或定义名与其他元素类型冲突
     */
    public void register(ListInstantiation instantiation) {
        String keyword = instantiation.getElementType().getKeyword();
        if (byElementType.containsKey(keyword)) {
            throw new InternalCompilerError("List instantiation already registered for: " + keyword);
        }
        String owner = byDefinitionName.get(instantiation.getDefinitionName());
        if (owner != null) {
            throw new InternalCompilerError("Definition name '" + instantiation.getDefinitionName()
                    + "' of " + keyword + " collides with " + owner);
        }
        byElementType.put(keyword, instantiation);
        byDefinitionName.put(instantiation.getDefinitionName(), keyword);
    }

    /**
     * 按注册顺序返回所有实例。
     */
    public List<ListInstantiation> getInstantiations() {
        return Collections.unmodifiableList(new ArrayList<>(byElementType.values()));
    }

    public int size() {
        return byElementType.size();
    }
}
