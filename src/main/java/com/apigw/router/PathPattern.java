package com.apigw.router;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 编译后的路径匹配器
 * :name 匹配单个路径段并按位置绑定参数，* 匹配任意字符且不作为参数捕获
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public final class PathPattern {

    private final String source;
    private final Pattern regex;
    private final List<String> paramNames;
    private final boolean dynamic;
    private final String literalPrefix;

    private PathPattern(String source, Pattern regex, List<String> paramNames, boolean dynamic, String literalPrefix) {
        this.source = source;
        this.regex = regex;
        this.paramNames = paramNames;
        this.dynamic = dynamic;
        this.literalPrefix = literalPrefix;
    }

    /**
     * 编译路径模式
     *
     * @param path 已规范化的路径模式
     * @return 匹配器
     */
    public static PathPattern compile(String path) {
        boolean dynamic = isDynamic(path);
        if (!dynamic) {
            return new PathPattern(path, null, Collections.emptyList(), false, path);
        }

        List<String> names = new ArrayList<>();
        StringBuilder regex = new StringBuilder("^");
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == ':' && i + 1 < path.length() && isNameChar(path.charAt(i + 1))) {
                int end = i + 1;
                while (end < path.length() && isNameChar(path.charAt(end))) {
                    end++;
                }
                names.add(path.substring(i + 1, end));
                regex.append("([^/]+)");
                i = end;
            } else if (c == '*') {
                regex.append("(?:.*)");
                i++;
            } else {
                int end = i;
                while (end < path.length() && path.charAt(end) != ':' && path.charAt(end) != '*') {
                    end++;
                }
                regex.append(Pattern.quote(path.substring(i, end)));
                i = end;
            }
        }
        regex.append('$');

        return new PathPattern(path, Pattern.compile(regex.toString()),
                Collections.unmodifiableList(names), true, literalPrefix(path));
    }

    /**
     * 判断路径是否包含参数或通配符
     */
    public static boolean isDynamic(String path) {
        return path.indexOf(':') >= 0 || path.indexOf('*') >= 0;
    }

    /**
     * 匹配路径并提取参数
     *
     * @param path 请求路径
     * @return 参数表，不匹配时返回 null
     */
    public Map<String, String> match(String path) {
        if (!dynamic) {
            return source.equals(path) ? Collections.emptyMap() : null;
        }
        Matcher matcher = regex.matcher(path);
        if (!matcher.matches()) {
            return null;
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int g = 0; g < paramNames.size(); g++) {
            params.put(paramNames.get(g), matcher.group(g + 1));
        }
        return params;
    }

    public boolean isDynamic() {
        return dynamic;
    }

    /**
     * 模式中第一个参数段或通配段之前的字面前缀（不含结尾斜杠）
     * 转发时从请求路径中剥离该前缀
     */
    public String getLiteralPrefix() {
        return literalPrefix;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    @Override
    public String toString() {
        return source;
    }

    private static String literalPrefix(String path) {
        int cut = path.length();
        int colon = path.indexOf(':');
        int star = path.indexOf('*');
        if (colon >= 0) {
            cut = Math.min(cut, colon);
        }
        if (star >= 0) {
            cut = Math.min(cut, star);
        }
        // 回退到所在路径段的起点
        int slash = path.lastIndexOf('/', cut - 1);
        String prefix = slash >= 0 ? path.substring(0, slash) : "";
        return prefix;
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
