package com.pluginroute.executor;

/**
 * Command-specific step run on a generated result, e.g. rendering a redlined
 * document from the structured data. Registered per command name in the table
 * handed to {@link CommandExecutor}.
 */
@FunctionalInterface
public interface PostProcessor {

    PluginResult process(PluginResult result, PluginInvocation invocation) throws Exception;
}
