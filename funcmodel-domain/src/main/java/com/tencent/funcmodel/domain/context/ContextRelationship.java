package com.tencent.funcmodel.domain.context;

/**
 * ContextRelationship - 请求节点相对于上下文所有者的位置
 */
public enum ContextRelationship {

    SELF("self"),
    ANCESTOR("ancestor"),
    DESCENDANT("descendant"),
    SIBLING("sibling"),
    UNRELATED("unrelated");

    private final String value;

    ContextRelationship(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
