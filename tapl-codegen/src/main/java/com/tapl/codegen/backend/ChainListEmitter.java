package com.tapl.codegen.backend;

/**
 * 生成单一元素类型的链表实现（C 源码）。
 *
 * <p>对定义名 {@code N}、元素类型 {@code T} 生成：</p>
 * <ul>
 *   <li>{@code N_element}：值 + 后继指针</li>
 *   <li>{@code N}：head、tail、访问缓存、size</li>
 *   <li>{@code N_constructor}、{@code N_destructor}、{@code N_cache_invalidate}、{@code N_size}</li>
 *   <li>{@code N_add}、{@code N_get}、{@code N_set}、{@code N_del}、{@code N_insert}</li>
 * </ul>
 *
 * <p>生成的单元只依赖 {@code T} 自身的定义、{@code types.h} 中的
 * {@code bool}/{@code u64} 以及 {@code panic}，不引用其他实例。</p>
 */
public class ChainListEmitter {

    private final EmitConfig config;

    public ChainListEmitter(EmitConfig config) {
        this.config = config;
    }

    public ChainListEmitter() {
        this(new EmitConfig());
    }

    /**
     * 生成完整定义。
     *
     * @param name        定义名，例如 {@code list_u8}
     * @param elementType 元素的 C 类型名，例如 {@code u8}
     * @return C 源码片段
     */
    public String emit(String name, String elementType) {
        CSourceWriter w = new CSourceWriter(config);
        w.line("// " + name + ": singly linked list of " + elementType);
        emitStructs(w, name, elementType);
        w.blankLine();
        emitLifecycle(w, name, elementType);
        w.blankLine();
        emitAdd(w, name, elementType);
        w.blankLine();
        emitLocate(w, name);
        w.blankLine();
        emitGetSet(w, name, elementType);
        w.blankLine();
        emitDel(w, name);
        w.blankLine();
        emitInsert(w, name, elementType);
        return w.getOutput();
    }

    private void emitStructs(CSourceWriter w, String name, String elementType) {
        String element = name + "_element";
        w.line("typedef struct " + element + "_struct " + element + ";");
        w.openBlock("struct " + element + "_struct");
        w.line(elementType + " value;");
        w.line(element + "* next;");
        w.closeBlock("};");
        w.line("typedef struct " + name + "_struct " + name + ";");
        w.openBlock("struct " + name + "_struct");
        w.line(element + "* head;");
        w.line(element + "* tail;");
        // 最近一次解析的索引及其元素
        w.line("bool cache_valid;");
        w.line("u64 cache_index;");
        w.line(element + "* cache_element;");
        w.line("u64 size;");
        w.closeBlock("};");
    }

    private void emitLifecycle(CSourceWriter w, String name, String elementType) {
        String element = name + "_element";
        w.openBlock("void " + name + "_constructor(" + name + "* this)");
        w.line("this->head = NULL;");
        w.line("this->tail = NULL;");
        w.line("this->cache_valid = false;");
        w.line("this->cache_index = 0;");
        w.line("this->cache_element = NULL;");
        w.line("this->size = 0;");
        w.closeBlock();
        w.openBlock("void " + name + "_cache_invalidate(" + name + "* this)");
        w.line("this->cache_valid = false;");
        w.closeBlock();
        w.openBlock("void " + name + "_destructor(" + name + "* this)");
        w.line(element + "* element = this->head;");
        w.openBlock("while (element != NULL)");
        w.line(element + "* next = element->next;");
        w.line("free(element);");
        w.line("element = next;");
        w.closeBlock();
        w.line(name + "_constructor(this);");
        w.closeBlock();
        w.openBlock("u64 " + name + "_size(" + name + "* this)");
        w.line("return this->size;");
        w.closeBlock();
        w.openBlock(element + "* " + name + "_new_element(" + elementType + " value, " + element + "* next)");
        w.line(element + "* element = malloc(sizeof(" + element + "));");
        w.line("if (element == NULL)");
        w.indent();
        w.line("panic(\"out of memory in " + name + "_new_element\");");
        w.dedent();
        w.line("element->value = value;");
        w.line("element->next = next;");
        w.line("return element;");
        w.closeBlock();
    }

    private void emitAdd(CSourceWriter w, String name, String elementType) {
        w.openBlock("void " + name + "_add(" + name + "* this, " + elementType + " value)");
        w.line(name + "_cache_invalidate(this);");
        w.line(name + "_element* new_element = " + name + "_new_element(value, NULL);");
        w.openBlock("if (this->head == NULL)");
        w.line("this->head = new_element;");
        w.continueBlock("} else {");
        w.line("this->tail->next = new_element;");
        w.closeBlock();
        w.line("this->tail = new_element;");
        w.line("this->size++;");
        w.closeBlock();
    }

    /**
     * get/set 共用的查找：缓存有效且目标不在缓存之前时从缓存元素继续，
     * 缓存键是请求的绝对索引；越界时 panic，不修改缓存。
     */
    private void emitLocate(CSourceWriter w, String name) {
        String element = name + "_element";
        w.openBlock(element + "* " + name + "_locate(" + name + "* this, u64 index, const char* fault)");
        w.line("u64 remaining = index;");
        w.line(element + "* element = this->head;");
        w.openBlock("if (this->cache_valid && index >= this->cache_index)");
        w.line("element = this->cache_element;");
        w.line("remaining -= this->cache_index;");
        w.closeBlock();
        emitWalk(w);
        w.line("if (remaining > 0 || element == NULL)");
        w.indent();
        w.line("panic(fault);");
        w.dedent();
        w.line("this->cache_valid = true;");
        w.line("this->cache_index = index;");
        w.line("this->cache_element = element;");
        w.line("return element;");
        w.closeBlock();
    }

    private void emitGetSet(CSourceWriter w, String name, String elementType) {
        w.openBlock(elementType + " " + name + "_get(" + name + "* this, u64 index)");
        w.line("return " + name + "_locate(this, index, \"" + fault(name, "get") + "\")->value;");
        w.closeBlock();
        w.openBlock("void " + name + "_set(" + name + "* this, u64 index, " + elementType + " value)");
        w.line(name + "_locate(this, index, \"" + fault(name, "set") + "\")->value = value;");
        w.closeBlock();
    }

    private void emitDel(CSourceWriter w, String name) {
        String element = name + "_element";
        w.openBlock("void " + name + "_del(" + name + "* this, u64 index)");
        w.line(name + "_cache_invalidate(this);");
        w.openBlock("if (index == 0)");
        w.line("if (this->head == NULL)");
        w.indent();
        w.line("panic(\"" + fault(name, "del") + "\");");
        w.dedent();
        w.line(element + "* inner = this->head->next;");
        w.line("free(this->head);");
        w.line("this->head = inner;");
        w.line("if (inner == NULL)");
        w.indent();
        w.line("this->tail = NULL;");
        w.dedent();
        w.line("this->size--;");
        w.line("return;");
        w.closeBlock();
        w.line("u64 remaining = index - 1;");
        w.line(element + "* element = this->head;");
        emitWalk(w);
        w.line("if (remaining > 0 || element == NULL || element->next == NULL)");
        w.indent();
        w.line("panic(\"" + fault(name, "del") + "\");");
        w.dedent();
        w.line(element + "* inner = element->next->next;");
        w.line("free(element->next);");
        w.line("element->next = inner;");
        w.line("if (inner == NULL)");
        w.indent();
        w.line("this->tail = element;");
        w.dedent();
        w.line("this->size--;");
        w.closeBlock();
    }

    private void emitInsert(CSourceWriter w, String name, String elementType) {
        String element = name + "_element";
        w.openBlock("void " + name + "_insert(" + name + "* this, u64 index, " + elementType + " value)");
        w.line(name + "_cache_invalidate(this);");
        w.openBlock("if (index == 0)");
        w.line("this->head = " + name + "_new_element(value, this->head);");
        w.line("if (this->tail == NULL)");
        w.indent();
        w.line("this->tail = this->head;");
        w.dedent();
        w.line("this->size++;");
        w.line("return;");
        w.closeBlock();
        w.line("u64 remaining = index - 1;");
        w.line(element + "* element = this->head;");
        emitWalk(w);
        w.line("if (remaining > 0 || element == NULL)");
        w.indent();
        w.line("panic(\"" + fault(name, "insert") + "\");");
        w.dedent();
        w.line(element + "* new_element = " + name + "_new_element(value, element->next);");
        w.line("element->next = new_element;");
        w.line("if (new_element->next == NULL)");
        w.indent();
        w.line("this->tail = new_element;");
        w.dedent();
        w.line("this->size++;");
        w.closeBlock();
    }

    private void emitWalk(CSourceWriter w) {
        w.openBlock("while (element != NULL && remaining > 0)");
        w.line("element = element->next;");
        w.line("remaining--;");
        w.closeBlock();
    }

    static String fault(String name, String operation) {
        return "index out of bounds in " + name + "_" + operation;
    }
}
