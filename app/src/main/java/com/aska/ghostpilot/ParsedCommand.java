package com.aska.ghostpilot;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 解析中间结果：动作名、位置参数、key=value 参数
 *
 * 只在 {@link ActionParser} 内部使用，构造动作后即丢弃。
 */
final class ParsedCommand {

    final String name;
    final List<String> args;          // 未命名参数，已去除外层引号
    final Map<String, String> params; // 命名参数，已去除外层引号
    final String argumentText;        // 括号内的原始内容（不含动作名）
    final boolean wrapped;            // 是否为 do(...) 形式
    final String source;              // 匹配到的原始片段，用于诊断

    ParsedCommand(String name, List<String> args, Map<String, String> params,
                  String argumentText, boolean wrapped, String source) {
        this.name = name;
        this.args = Collections.unmodifiableList(args);
        this.params = Collections.unmodifiableMap(params);
        this.argumentText = argumentText;
        this.wrapped = wrapped;
        this.source = source;
    }

    String param(String... keys) {
        for (String key : keys) {
            String value = params.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    String firstArg() {
        return args.isEmpty() ? null : args.get(0);
    }

    boolean isSensitive() {
        String value = params.get("sensitive");
        if (value == null) return false;
        String v = value.trim().toLowerCase();
        return v.equals("true") || v.equals("1") || v.equals("yes");
    }

    @Override
    public String toString() {
        return "ParsedCommand{name=" + name + ", args=" + args + ", params=" + params
            + ", wrapped=" + wrapped + "}";
    }
}
