package com.apigw.auth;

import com.apigw.model.RequestContext;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.cookie.Cookie;
import io.netty.handler.codec.http.cookie.ServerCookieDecoder;

import java.util.List;
import java.util.Set;

/**
 * 凭证提取
 * 优先级：Authorization Bearer 头 > token 查询参数 > token Cookie
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public final class CredentialResolver {

    public static final String TOKEN_NAME = "token";

    private static final String BEARER_PREFIX = "Bearer ";

    private CredentialResolver() {
    }

    /**
     * 从请求中提取凭证
     *
     * @param context 请求上下文
     * @return 凭证，不存在时返回 null
     */
    public static String resolve(RequestContext context) {
        String authorization = context.getHeader(HttpHeaderNames.AUTHORIZATION.toString());
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }

        if (context.getQueryString() != null && !context.getQueryString().isEmpty()) {
            QueryStringDecoder decoder = new QueryStringDecoder(context.getQueryString(), false);
            List<String> values = decoder.parameters().get(TOKEN_NAME);
            if (values != null && !values.isEmpty() && !values.get(0).isEmpty()) {
                return values.get(0);
            }
        }

        String cookieHeader = context.getHeader(HttpHeaderNames.COOKIE.toString());
        if (cookieHeader != null && !cookieHeader.isEmpty()) {
            Set<Cookie> cookies = ServerCookieDecoder.LAX.decode(cookieHeader);
            for (Cookie cookie : cookies) {
                if (TOKEN_NAME.equals(cookie.name()) && !cookie.value().isEmpty()) {
                    return cookie.value();
                }
            }
        }
        return null;
    }
}
