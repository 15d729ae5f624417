package com.example.relayserver.model;

/**
 * 激活功能检测策略
 */
public enum DetectionMethod {

    /** 渲染页面上的复选框 + 参数行位置关联（Easergy 类导出） */
    CHECKBOX,

    /** 文本中 "标签 + 启用/禁用值" 字段（MiCOM P143 类导出） */
    LABELED_FIELD,

    /** [Section] 分节的 key=value 文本（SEPAM .S40 类导出） */
    KEYED_SECTION
}
