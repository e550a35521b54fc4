package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 预测模型配置
 */
public class ModelConfig implements Serializable {
    private ModelType type = ModelType.LOCAL;
    /** 本地模型标识，训练完成后由调用方更新为新模型 */
    private String id;
    /** 远程模型服务地址 */
    private String endpoint;
    /** 远程调用的数据格式：json / parquet */
    private String serializationFormat = "json";
    /** 透传给模型的参数 */
    private Map<String, Object> parameters = new LinkedHashMap<>();
    /** 预测分位数；为空时使用默认分位数集合 */
    private List<Double> quantileLevels = new ArrayList<>();

    public ModelConfig() {}

    public ModelConfig(ModelType type, String id) {
        this.type = type;
        this.id = id;
    }

    public ModelType getType() { return type; }
    public void setType(ModelType type) { this.type = type; }
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public String getSerializationFormat() { return serializationFormat; }
    public void setSerializationFormat(String serializationFormat) { this.serializationFormat = serializationFormat; }
    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) {
        this.parameters = (parameters != null) ? parameters : new LinkedHashMap<>();
    }
    public List<Double> getQuantileLevels() { return quantileLevels; }
    public void setQuantileLevels(List<Double> quantileLevels) {
        this.quantileLevels = (quantileLevels != null) ? quantileLevels : new ArrayList<>();
    }
}
