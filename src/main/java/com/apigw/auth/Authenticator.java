package com.apigw.auth;

import reactor.core.publisher.Mono;

/**
 * 认证组件
 * 网关只消费其结果，不解析凭证内容
 *
 * @author Gateway Team
 * @version 1.0.0
 */
public interface Authenticator {

    /**
     * 校验凭证
     *
     * @param credential 凭证
     * @param requestId  请求 ID（用于日志关联）
     * @return 认证通过时返回身份信息，凭证无效时返回空
     */
    Mono<AuthenticatedPrincipal> authenticate(String credential, String requestId);
}
