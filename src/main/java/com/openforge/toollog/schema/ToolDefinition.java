package com.openforge.toollog.schema;

/**
 * A tool whose executions can be logged. Either a {@link NativeTool} or an
 * {@link ApiTool}; callers dispatch on {@link #kind()}.
 */
public sealed interface ToolDefinition permits NativeTool, ApiTool {

    ToolKind kind();

    /** Stable identifier of the tool in its registry. */
    String id();
}
