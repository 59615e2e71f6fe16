package com.aska.ghostpilot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 动作字符串解析器
 *
 * 职责：
 * 1. 解析 do(name, key=value, ...) 与 finish(...) 格式
 * 2. 兼容 tap(100, 200) 这类直接调用格式
 * 3. 引号感知的括号匹配（引号内的括号不结束调用）
 * 4. 坐标、时长等参数的宽松解析
 *
 * 解析结果要么是一个完整的 {@link Action}，要么是一条失败原因，不会抛出异常。
 */
public class ActionParser {

    private static final Logger log = LoggerFactory.getLogger(Config.LOG_TAG + ".Parser");

    static final String EMPTY_FINISH_MESSAGE = "completed with no action";

    // 未指定时长的 wait
    private static final long DEFAULT_WAIT_MS = 1000L;

    private static final Pattern WRAPPED_CALL =
        Pattern.compile("(?<![\\w])(finish|do)\\(", Pattern.CASE_INSENSITIVE);

    private static final Pattern BARE_CALL = Pattern.compile("([A-Za-z_]\\w*)\\(");

    private static final Pattern KEY_VALUE =
        Pattern.compile("^([A-Za-z_]\\w*)\\s*=\\s*(.*)$", Pattern.DOTALL);

    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");

    private static final Pattern DURATION = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(\\p{L}*)");

    private static final Set<String> COORDINATE_KEYS =
        new HashSet<>(Arrays.asList("element", "start", "end", "point"));

    /**
     * 解析一条动作字符串
     */
    public ParseResult parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            log.warn("Empty action string, treating as finish");
            return ParseResult.success(new Action.Finish(EMPTY_FINISH_MESSAGE), raw == null ? "" : raw);
        }

        String text = raw.trim();

        // ========== do(...) / finish(...) ==========
        Matcher wrapped = WRAPPED_CALL.matcher(text);
        if (wrapped.find()) {
            int open = wrapped.end() - 1;
            int close = findCloseOrFallback(text, open);
            String content = text.substring(open + 1, close);
            String source = text.substring(wrapped.start(), Math.min(close + 1, text.length()));

            if ("finish".equalsIgnoreCase(wrapped.group(1))) {
                return parseFinish(content, source);
            }
            return parseDo(content, source);
        }

        // ========== 直接调用 tap(100, 200) ==========
        Matcher bare = BARE_CALL.matcher(text);
        int start = -1;
        String name = null;
        while (bare.find()) {
            if (start < 0) {
                start = bare.start();
                name = bare.group(1);
            }
            if (ActionType.fromString(bare.group(1)) != ActionType.UNKNOWN) {
                start = bare.start();
                name = bare.group(1);
                break;
            }
        }
        if (name != null) {
            int open = start + name.length();
            int close = findCloseOrFallback(text, open);
            String content = text.substring(open + 1, close);
            String source = text.substring(start, Math.min(close + 1, text.length()));
            return parseBare(name, content, source);
        }

        log.warn("No action call found in: {}", text);
        return ParseResult.failure("No action call found", raw);
    }

    /**
     * 引号感知的括号匹配
     *
     * @param s 输入字符串
     * @param openIndex 左括号位置
     * @return 与之匹配的右括号位置，找不到时返回 -1
     */
    public static int findMatchingParen(String s, int openIndex) {
        if (s == null || openIndex < 0 || openIndex >= s.length()) {
            return -1;
        }

        int depth = 0;
        char quote = 0;
        for (int i = openIndex; i < s.length(); i++) {
            char c = s.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if ((c == '"' || c == '\'') && opensQuote(s, i, openIndex + 1)) {
                quote = c;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    // ========== 各种调用形式 ==========

    private ParseResult parseFinish(String content, String source) {
        String body = content.trim();
        Matcher kv = KEY_VALUE.matcher(body);
        String message;
        if (kv.matches() && ("message".equalsIgnoreCase(kv.group(1)) || "result".equalsIgnoreCase(kv.group(1)))) {
            message = unquote(kv.group(2));
        } else {
            message = unquote(body);
        }
        return ParseResult.success(new Action.Finish(message), source);
    }

    private ParseResult parseDo(String content, String source) {
        List<String> parts = splitTopLevel(content);
        if (parts.isEmpty()) {
            return ParseResult.failure("Empty do() call", source);
        }

        String name = null;
        int from = 0;
        if (!KEY_VALUE.matcher(parts.get(0)).matches()) {
            name = unquote(parts.get(0));
            from = 1;
        }

        Map<String, String> params = new LinkedHashMap<>();
        List<String> args = new ArrayList<>();
        collect(parts, from, params, args);

        // do(action="Tap", element=[...]) 形式
        if (name == null) {
            name = params.get("action");
        }
        if (name == null || name.trim().isEmpty()) {
            return ParseResult.failure("Missing action name", source);
        }

        int comma = content.indexOf(',');
        String argumentText = from == 1 && comma >= 0 ? content.substring(comma + 1) : (from == 1 ? "" : content);

        return build(new ParsedCommand(name.trim(), args, params, argumentText, true, source));
    }

    private ParseResult parseBare(String name, String content, String source) {
        Map<String, String> params = new LinkedHashMap<>();
        List<String> args = new ArrayList<>();
        collect(splitTopLevel(content), 0, params, args);
        return build(new ParsedCommand(name, args, params, content, false, source));
    }

    // ========== 构造动作 ==========

    private ParseResult build(ParsedCommand cmd) {
        ActionType type = ActionType.fromString(cmd.name);
        boolean sensitive = cmd.isSensitive();
        String message = cmd.param("message");

        if (Config.DEBUG_MODE) {
            log.debug("Parsed {} as {}", cmd, type);
        }

        switch (type) {
            case TAP:
            case DOUBLE_TAP:
            case LONG_PRESS: {
                int[] p = point(cmd, "element", "point");
                if (p == null) {
                    return ParseResult.failure("Missing coordinates for " + type.canonicalName(), cmd.source);
                }
                Action action;
                if (type == ActionType.TAP) {
                    action = new Action.Tap(p[0], p[1], sensitive, message);
                } else if (type == ActionType.DOUBLE_TAP) {
                    action = new Action.DoubleTap(p[0], p[1], sensitive, message);
                } else {
                    action = new Action.LongPress(p[0], p[1], sensitive, message);
                }
                return ParseResult.success(action, cmd.source);
            }

            case SWIPE: {
                int[] start = coordinates(cmd.param("start"));
                int[] end = coordinates(cmd.param("end"));
                Integer positionalDuration = null;
                if (start == null || end == null) {
                    List<Integer> nums = positionalInts(cmd.args);
                    if (nums.size() >= 4) {
                        start = new int[]{nums.get(0), nums.get(1)};
                        end = new int[]{nums.get(2), nums.get(3)};
                        if (nums.size() >= 5) positionalDuration = nums.get(4);
                    }
                }
                if (start == null || end == null) {
                    return ParseResult.failure("Swipe requires start and end coordinates", cmd.source);
                }
                int duration = Config.DEFAULT_SWIPE_DURATION_MS;
                String durationParam = cmd.param("duration");
                if (durationParam != null) {
                    duration = (int) parseDurationMs(durationParam, false, Config.DEFAULT_SWIPE_DURATION_MS);
                } else if (positionalDuration != null) {
                    duration = positionalDuration;
                }
                return ParseResult.success(
                    new Action.Swipe(start[0], start[1], end[0], end[1], duration, sensitive, message), cmd.source);
            }

            case TYPE: {
                String text = cmd.param("text", "content", "value");
                if (text == null) {
                    text = positionalText(cmd);
                }
                return ParseResult.success(new Action.Type(text, sensitive, message), cmd.source);
            }

            case LAUNCH: {
                String app = cmd.param("app", "package", "app_name", "name");
                if (app == null) {
                    app = cmd.firstArg();
                }
                if (app == null || app.trim().isEmpty()) {
                    return ParseResult.failure("Missing app for launch", cmd.source);
                }
                return ParseResult.success(new Action.Launch(app.trim(), sensitive, message), cmd.source);
            }

            case BACK:
                return ParseResult.success(new Action.Back(sensitive, message), cmd.source);

            case HOME:
                return ParseResult.success(new Action.Home(sensitive, message), cmd.source);

            case WAIT: {
                // do(wait, duration=2) 以秒为单位；直接调用 wait(2000) 以毫秒为单位
                String value = cmd.param("duration", "time");
                if (value == null) value = cmd.firstArg();
                long durationMs = value == null
                    ? DEFAULT_WAIT_MS
                    : parseDurationMs(value, cmd.wrapped, DEFAULT_WAIT_MS);
                return ParseResult.success(new Action.Wait(durationMs), cmd.source);
            }

            case TAKE_OVER:
                return ParseResult.success(
                    new Action.TakeOver(message != null ? message : positionalText(cmd)), cmd.source);

            case FINISH:
                return ParseResult.success(
                    new Action.Finish(message != null ? message : positionalText(cmd)), cmd.source);

            case NOTE:
                return ParseResult.success(new Action.Note(freeText(cmd)), cmd.source);

            case CALL_API:
                return ParseResult.success(new Action.CallApi(freeText(cmd)), cmd.source);

            case INTERACT:
                return ParseResult.success(new Action.Interact(freeText(cmd)), cmd.source);

            case UNKNOWN:
            default:
                log.warn("Unknown action name: {}", cmd.name);
                return ParseResult.success(new Action.Unknown(cmd.name, cmd.source), cmd.source);
        }
    }

    private static String freeText(ParsedCommand cmd) {
        String text = cmd.param("message", "text", "content");
        return text != null ? text : positionalText(cmd);
    }

    /**
     * 未命名参数组成的文本；只有一个参数时去掉外层引号，多个时保留原文
     */
    private static String positionalText(ParsedCommand cmd) {
        if (cmd.args.isEmpty()) return "";
        if (cmd.args.size() == 1 || !cmd.params.isEmpty()) return cmd.args.get(0);
        return unquote(cmd.argumentText);
    }

    // ========== 参数切分 ==========

    /**
     * 按顶层逗号切分，忽略引号、方括号和圆括号内的逗号
     */
    static List<String> splitTopLevel(String content) {
        List<String> parts = new ArrayList<>();
        if (content == null) return parts;

        int depth = 0;
        char quote = 0;
        int start = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if ((c == '"' || c == '\'') && opensQuote(content, i, start)) {
                quote = c;
            } else if (c == '[' || c == '(') {
                depth++;
            } else if ((c == ']' || c == ')') && depth > 0) {
                depth--;
            } else if (c == ',' && depth == 0) {
                addPart(parts, content.substring(start, i));
                start = i + 1;
            }
        }
        addPart(parts, content.substring(start));
        return parts;
    }

    private static void addPart(List<String> parts, String part) {
        String trimmed = part.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }

    /**
     * 只有出现在值开头的引号才开启引号状态，单词中的撇号（don't）不算
     */
    private static boolean opensQuote(String s, int index, int segmentStart) {
        int j = index - 1;
        while (j >= segmentStart && Character.isWhitespace(s.charAt(j))) {
            j--;
        }
        if (j < segmentStart) return true;
        char prev = s.charAt(j);
        return prev == '=' || prev == ',' || prev == '(' || prev == '[';
    }

    private static void collect(List<String> parts, int from, Map<String, String> params, List<String> args) {
        String lastKey = null;
        for (int i = from; i < parts.size(); i++) {
            String part = parts.get(i);
            Matcher kv = KEY_VALUE.matcher(part);
            if (kv.matches()) {
                lastKey = kv.group(1).toLowerCase();
                params.put(lastKey, unquote(kv.group(2)));
            } else if (lastKey != null && COORDINATE_KEYS.contains(lastKey)
                    && NUMBER.matcher(params.get(lastKey).trim()).matches()
                    && NUMBER.matcher(part).matches()) {
                // element=100,200 没有括号时会被切成两段，这里合并回去
                params.put(lastKey, params.get(lastKey).trim() + "," + part);
            } else {
                args.add(unquote(part));
                lastKey = null;
            }
        }
    }

    // ========== 值解析 ==========

    private static int[] point(ParsedCommand cmd, String... keys) {
        for (String key : keys) {
            int[] coords = coordinates(cmd.params.get(key));
            if (coords != null) return coords;
        }
        List<Integer> nums = positionalInts(cmd.args);
        if (nums.size() >= 2) {
            return new int[]{nums.get(0), nums.get(1)};
        }
        return null;
    }

    /**
     * 解析坐标：[x, y]、(x, y) 或 x,y；不足两个数值时返回 null
     */
    static int[] coordinates(String value) {
        if (value == null || value.trim().isEmpty()) return null;
        List<Integer> nums = numbers(value);
        if (nums.size() < 2) return null;
        int[] result = new int[nums.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = nums.get(i);
        }
        return result;
    }

    private static List<Integer> positionalInts(List<String> args) {
        List<Integer> nums = new ArrayList<>();
        for (String arg : args) {
            nums.addAll(numbers(arg));
        }
        return nums;
    }

    private static List<Integer> numbers(String value) {
        String cleaned = value.trim();
        if (cleaned.startsWith("[") || cleaned.startsWith("(")) cleaned = cleaned.substring(1);
        if (cleaned.endsWith("]") || cleaned.endsWith(")")) cleaned = cleaned.substring(0, cleaned.length() - 1);

        List<Integer> nums = new ArrayList<>();
        for (String token : cleaned.split(",")) {
            String t = token.trim();
            if (NUMBER.matcher(t).matches()) {
                nums.add((int) Math.round(Double.parseDouble(t)));
            }
        }
        return nums;
    }

    /**
     * 解析时长：支持 "2 seconds"、"2s"、"1.5 sec"、"500 ms"、"2秒"
     *
     * @param unitlessSeconds 没有单位时是否按秒计
     */
    static long parseDurationMs(String value, boolean unitlessSeconds, long fallback) {
        if (value == null) return fallback;
        Matcher m = DURATION.matcher(unquote(value).toLowerCase());
        if (!m.find()) {
            return fallback;
        }

        double amount = Double.parseDouble(m.group(1));
        double factor;
        switch (m.group(2)) {
            case "":
                factor = unitlessSeconds ? 1000 : 1;
                break;
            case "ms":
            case "msec":
            case "millis":
            case "millisecond":
            case "milliseconds":
            case "毫秒":
                factor = 1;
                break;
            case "s":
            case "sec":
            case "secs":
            case "second":
            case "seconds":
            case "秒":
                factor = 1000;
                break;
            case "m":
            case "min":
            case "mins":
            case "minute":
            case "minutes":
            case "分钟":
                factor = 60 * 1000;
                break;
            default:
                factor = unitlessSeconds ? 1000 : 1;
                break;
        }
        return Math.round(amount * factor);
    }

    static String unquote(String value) {
        if (value == null) return null;
        String v = value.trim();
        if (v.length() >= 2) {
            char first = v.charAt(0);
            char last = v.charAt(v.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return v.substring(1, v.length() - 1);
            }
        }
        return v;
    }

    private static int findCloseOrFallback(String text, int open) {
        int close = findMatchingParen(text, open);
        if (close < 0) {
            close = text.lastIndexOf(')');
            if (close <= open) {
                close = text.length();
            }
        }
        return close;
    }
}
