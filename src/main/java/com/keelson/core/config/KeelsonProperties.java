package com.keelson.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "keelson")
public class KeelsonProperties {

    private Events events = new Events();
    private Conversation conversation = new Conversation();
    private Pty pty = new Pty();
    private Agent agent = new Agent();
    private Attachments attachments = new Attachments();
    private List<WorkdirSeed> workdirs = new ArrayList<>();

    public Events getEvents() { return events; }
    public void setEvents(Events events) { this.events = events; }
    public Conversation getConversation() { return conversation; }
    public void setConversation(Conversation conversation) { this.conversation = conversation; }
    public Pty getPty() { return pty; }
    public void setPty(Pty pty) { this.pty = pty; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Attachments getAttachments() { return attachments; }
    public void setAttachments(Attachments attachments) { this.attachments = attachments; }
    public List<WorkdirSeed> getWorkdirs() { return workdirs; }
    public void setWorkdirs(List<WorkdirSeed> workdirs) { this.workdirs = workdirs; }

    public static class Events {
        /** Per-connection fan-out queue length before the connection is marked lagging. */
        private int channelCapacity = 256;
        private int sendTimeLimitMs = 10_000;
        private int sendBufferSizeBytes = 4 * 1024 * 1024;

        public int getChannelCapacity() { return channelCapacity; }
        public void setChannelCapacity(int channelCapacity) { this.channelCapacity = channelCapacity; }
        public int getSendTimeLimitMs() { return sendTimeLimitMs; }
        public void setSendTimeLimitMs(int sendTimeLimitMs) { this.sendTimeLimitMs = sendTimeLimitMs; }
        public int getSendBufferSizeBytes() { return sendBufferSizeBytes; }
        public void setSendBufferSizeBytes(int sendBufferSizeBytes) { this.sendBufferSizeBytes = sendBufferSizeBytes; }
    }

    public static class Conversation {
        /** Entries carried by a conversation_changed event. */
        private int eventPageSize = 200;
        private int maxPageSize = 5000;

        public int getEventPageSize() { return eventPageSize; }
        public void setEventPageSize(int eventPageSize) { this.eventPageSize = eventPageSize; }
        public int getMaxPageSize() { return maxPageSize; }
        public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
    }

    public static class Pty {
        private int historyBytes = 512 * 1024;
        private int liveQueueCapacity = 64;
        private String shell = "";
        private int outputTailBytes = 4096;
        /** Finished one-shot command sessions kept for replay; older ones are dropped. */
        private int commandRetention = 8;

        public int getHistoryBytes() { return historyBytes; }
        public void setHistoryBytes(int historyBytes) { this.historyBytes = historyBytes; }
        public int getLiveQueueCapacity() { return liveQueueCapacity; }
        public void setLiveQueueCapacity(int liveQueueCapacity) { this.liveQueueCapacity = liveQueueCapacity; }
        public String getShell() { return shell; }
        public void setShell(String shell) { this.shell = shell; }
        public int getOutputTailBytes() { return outputTailBytes; }
        public void setOutputTailBytes(int outputTailBytes) { this.outputTailBytes = outputTailBytes; }
        public int getCommandRetention() { return commandRetention; }
        public void setCommandRetention(int commandRetention) { this.commandRetention = commandRetention; }

        /**
         * Returns the configured shell, falling back to {@code $SHELL} and then {@code /bin/sh}.
         */
        public String resolveShell() {
            if (shell != null && !shell.isBlank()) {
                return shell;
            }
            String env = System.getenv("SHELL");
            if (env != null && !env.isBlank()) return env;
            return "/bin/sh";
        }
    }

    public static class Agent {
        /** {@code echo} or {@code process}. */
        private String executor = "echo";
        private List<String> command = new ArrayList<>();
        private int maxConcurrentTurns = 4;
        private long echoStepDelayMs = 250;

        public String getExecutor() { return executor; }
        public void setExecutor(String executor) { this.executor = executor; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public int getMaxConcurrentTurns() { return maxConcurrentTurns; }
        public void setMaxConcurrentTurns(int maxConcurrentTurns) { this.maxConcurrentTurns = maxConcurrentTurns; }
        public long getEchoStepDelayMs() { return echoStepDelayMs; }
        public void setEchoStepDelayMs(long echoStepDelayMs) { this.echoStepDelayMs = echoStepDelayMs; }
    }

    public static class Attachments {
        private String dir = System.getProperty("java.io.tmpdir") + "/keelson/attachments";
        private long maxBytes = 20L * 1024 * 1024;

        public String getDir() { return dir; }
        public void setDir(String dir) { this.dir = dir; }
        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }
    }

    /**
     * A project checkout registered at startup.
     */
    public static class WorkdirSeed {
        private String name;
        private String path;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }
}
