package com.lodestar.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "lodestar")
public class LodestarProperties {

    private Store store = new Store();
    private Engine engine = new Engine();
    private String bootstrapFile = ".lodestar.yaml";

    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public String getBootstrapFile() { return bootstrapFile; }
    public void setBootstrapFile(String bootstrapFile) { this.bootstrapFile = bootstrapFile; }

    public static class Store {
        /** memory, file or jdbc */
        private String type = "file";
        private String root = ".lodestar_state";
        private Jdbc jdbc = new Jdbc();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public Jdbc getJdbc() { return jdbc; }
        public void setJdbc(Jdbc jdbc) { this.jdbc = jdbc; }
    }

    public static class Jdbc {
        private String url = "jdbc:h2:file:./.lodestar_state/lodestar";
        private String username = "sa";
        private String password = "";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
    }

    public static class Engine {
        private int maxIterations = 100;
        private int maxStalledIterations = 2;
        private int maxActionRetries = 2;
        private boolean clearSessionOnTerminal = false;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getMaxStalledIterations() { return maxStalledIterations; }
        public void setMaxStalledIterations(int maxStalledIterations) { this.maxStalledIterations = maxStalledIterations; }
        public int getMaxActionRetries() { return maxActionRetries; }
        public void setMaxActionRetries(int maxActionRetries) { this.maxActionRetries = maxActionRetries; }
        public boolean isClearSessionOnTerminal() { return clearSessionOnTerminal; }
        public void setClearSessionOnTerminal(boolean clearSessionOnTerminal) { this.clearSessionOnTerminal = clearSessionOnTerminal; }
    }
}
