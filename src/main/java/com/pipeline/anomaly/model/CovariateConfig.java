package com.pipeline.anomaly.model;

import java.io.Serializable;

/**
 * 协变量序列配置：查询语句 + 输入模型时使用的序列名
 */
public class CovariateConfig implements Serializable {
    private String query;
    private String name;

    public CovariateConfig() {}

    public CovariateConfig(String query, String name) {
        this.query = query;
        this.name = name;
    }

    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
}
