package com.raditha.cocotb.engine;

public enum Severity {
    INFO,
    WARNING,
    ERROR
}
