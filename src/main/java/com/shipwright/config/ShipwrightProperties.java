package com.shipwright.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "shipwright")
public class ShipwrightProperties {

    private String projectRoot = ".";
    private String image = "vcp-ml";
    private String stateDir = "deployment/state";
    private String eventLog = "deployment/logs/deployment_events.jsonl";
    private Map<String, Environment> environments = defaultEnvironments();
    private Validator validator = new Validator();
    private Smoke smoke = new Smoke();
    private Monitor monitor = new Monitor();
    private Rollback rollback = new Rollback();
    private Docker docker = new Docker();

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public String getStateDir() { return stateDir; }
    public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    public String getEventLog() { return eventLog; }
    public void setEventLog(String eventLog) { this.eventLog = eventLog; }
    public Map<String, Environment> getEnvironments() { return environments; }
    public void setEnvironments(Map<String, Environment> environments) { this.environments = environments; }
    public Validator getValidator() { return validator; }
    public void setValidator(Validator validator) { this.validator = validator; }
    public Smoke getSmoke() { return smoke; }
    public void setSmoke(Smoke smoke) { this.smoke = smoke; }
    public Monitor getMonitor() { return monitor; }
    public void setMonitor(Monitor monitor) { this.monitor = monitor; }
    public Rollback getRollback() { return rollback; }
    public void setRollback(Rollback rollback) { this.rollback = rollback; }
    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }

    private static Map<String, Environment> defaultEnvironments() {
        var envs = new LinkedHashMap<String, Environment>();

        var staging = new Environment();
        staging.setPort(8001);
        staging.setWorkers(2);
        staging.setTagPrefix("staging");
        staging.setContainerName("vcp-ml-staging");
        staging.setMonitorWindowSeconds(60);
        envs.put("staging", staging);

        var production = new Environment();
        production.setPort(8000);
        production.setWorkers(4);
        production.setTagPrefix("prod");
        production.setContainerName("vcp-ml-production");
        production.setMonitorWindowSeconds(300);
        envs.put("production", production);

        return envs;
    }

    public static class Environment {
        private int port = 8000;
        private int containerPort = 8000;
        private int workers = 1;
        private String tagPrefix = "";
        private String containerName = "";
        private long monitorWindowSeconds = 60;
        private long monitorIntervalSeconds = 30;
        private double rollbackThreshold = 0.95;
        private long startupGraceSeconds = 30;
        private String baseUrl = "";

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public int getContainerPort() { return containerPort; }
        public void setContainerPort(int containerPort) { this.containerPort = containerPort; }
        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public String getTagPrefix() { return tagPrefix; }
        public void setTagPrefix(String tagPrefix) { this.tagPrefix = tagPrefix; }
        public String getContainerName() { return containerName; }
        public void setContainerName(String containerName) { this.containerName = containerName; }
        public long getMonitorWindowSeconds() { return monitorWindowSeconds; }
        public void setMonitorWindowSeconds(long monitorWindowSeconds) { this.monitorWindowSeconds = monitorWindowSeconds; }
        public long getMonitorIntervalSeconds() { return monitorIntervalSeconds; }
        public void setMonitorIntervalSeconds(long monitorIntervalSeconds) { this.monitorIntervalSeconds = monitorIntervalSeconds; }
        public double getRollbackThreshold() { return rollbackThreshold; }
        public void setRollbackThreshold(double rollbackThreshold) { this.rollbackThreshold = rollbackThreshold; }
        public long getStartupGraceSeconds() { return startupGraceSeconds; }
        public void setStartupGraceSeconds(long startupGraceSeconds) { this.startupGraceSeconds = startupGraceSeconds; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }

    public static class Validator {
        private List<String> testCommand = new ArrayList<>(List.of("pytest", "tests/", "-v", "--tb=short"));
        private long testTimeoutSeconds = 120;
        private long buildTimeoutSeconds = 300;
        private List<String> requiredEnv = new ArrayList<>(List.of("ENVIRONMENT", "API_HOST", "API_PORT"));
        private List<String> recommendedEnv = new ArrayList<>(List.of("LOG_LEVEL", "DATABASE_PATH", "MODEL_REGISTRY_PATH"));
        private String dataDir = "data";
        private List<String> dataFiles = new ArrayList<>(List.of(
                "price_movements.db",
                "features/technical_features.db",
                "features/financial_data.db",
                "features/financial_features.db"));
        private String registryFile = "models/registry/model_registry.db";

        public List<String> getTestCommand() { return testCommand; }
        public void setTestCommand(List<String> testCommand) { this.testCommand = testCommand; }
        public long getTestTimeoutSeconds() { return testTimeoutSeconds; }
        public void setTestTimeoutSeconds(long testTimeoutSeconds) { this.testTimeoutSeconds = testTimeoutSeconds; }
        public long getBuildTimeoutSeconds() { return buildTimeoutSeconds; }
        public void setBuildTimeoutSeconds(long buildTimeoutSeconds) { this.buildTimeoutSeconds = buildTimeoutSeconds; }
        public List<String> getRequiredEnv() { return requiredEnv; }
        public void setRequiredEnv(List<String> requiredEnv) { this.requiredEnv = requiredEnv; }
        public List<String> getRecommendedEnv() { return recommendedEnv; }
        public void setRecommendedEnv(List<String> recommendedEnv) { this.recommendedEnv = recommendedEnv; }
        public String getDataDir() { return dataDir; }
        public void setDataDir(String dataDir) { this.dataDir = dataDir; }
        public List<String> getDataFiles() { return dataFiles; }
        public void setDataFiles(List<String> dataFiles) { this.dataFiles = dataFiles; }
        public String getRegistryFile() { return registryFile; }
        public void setRegistryFile(String registryFile) { this.registryFile = registryFile; }
    }

    public static class Smoke {
        private String apiPrefix = "";
        private long requestTimeoutSeconds = 30;
        private long latencyBudgetMs = 100;
        private String metricsCounter = "prediction_requests_total";
        private String predictionDate = "2025-11-14";
        private String sampleSymbol = "RELIANCE";
        private List<String> sampleCodes = new ArrayList<>(List.of(
                "500325", "500112", "532540", "500180", "500209",
                "500510", "532174", "500696", "532978", "500010"));

        public String getApiPrefix() { return apiPrefix; }
        public void setApiPrefix(String apiPrefix) { this.apiPrefix = apiPrefix; }
        public long getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(long requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
        public long getLatencyBudgetMs() { return latencyBudgetMs; }
        public void setLatencyBudgetMs(long latencyBudgetMs) { this.latencyBudgetMs = latencyBudgetMs; }
        public String getMetricsCounter() { return metricsCounter; }
        public void setMetricsCounter(String metricsCounter) { this.metricsCounter = metricsCounter; }
        public String getPredictionDate() { return predictionDate; }
        public void setPredictionDate(String predictionDate) { this.predictionDate = predictionDate; }
        public String getSampleSymbol() { return sampleSymbol; }
        public void setSampleSymbol(String sampleSymbol) { this.sampleSymbol = sampleSymbol; }
        public List<String> getSampleCodes() { return sampleCodes; }
        public void setSampleCodes(List<String> sampleCodes) { this.sampleCodes = sampleCodes; }
    }

    public static class Monitor {
        private long requestTimeoutSeconds = 10;

        public long getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(long requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class Rollback {
        private boolean backupData = false;
        private long startTimeoutSeconds = 30;
        private long pollIntervalMillis = 500;

        public boolean isBackupData() { return backupData; }
        public void setBackupData(boolean backupData) { this.backupData = backupData; }
        public long getStartTimeoutSeconds() { return startTimeoutSeconds; }
        public void setStartTimeoutSeconds(long startTimeoutSeconds) { this.startTimeoutSeconds = startTimeoutSeconds; }
        public long getPollIntervalMillis() { return pollIntervalMillis; }
        public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }
    }

    public static class Docker {
        private String host = "";
        private String dataMountPath = "/app/data";
        private int logTail = 100;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public String getDataMountPath() { return dataMountPath; }
        public void setDataMountPath(String dataMountPath) { this.dataMountPath = dataMountPath; }
        public int getLogTail() { return logTail; }
        public void setLogTail(int logTail) { this.logTail = logTail; }
    }
}
