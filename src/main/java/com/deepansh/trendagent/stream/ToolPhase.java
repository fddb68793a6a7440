package com.deepansh.trendagent.stream;

public enum ToolPhase {
    started, completed, failed
}
