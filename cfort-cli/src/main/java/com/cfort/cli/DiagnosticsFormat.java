package com.cfort.cli;

/**
 * 诊断输出格式
 */
public enum DiagnosticsFormat {
    TEXT,
    JSON
}
