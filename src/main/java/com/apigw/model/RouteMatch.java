package com.apigw.model;

import lombok.Value;

import java.util.Map;

/**
 * 路由匹配结果
 * 路径参数与查询参数附着在匹配结果上，而不是路由本身
 *
 * @author Gateway Team
 * @version 1.0.0
 */
@Value
public class RouteMatch {

    RouteDefinition route;

    Map<String, String> params;

    Map<String, String> query;

    public String param(String name) {
        return params.get(name);
    }
}
