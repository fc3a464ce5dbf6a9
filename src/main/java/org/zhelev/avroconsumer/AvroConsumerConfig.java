package org.zhelev.avroconsumer;

import java.time.Duration;
import java.util.Properties;

public class AvroConsumerConfig {

    private boolean returnErrors = false;

    private boolean returnNotifications = false;

    private InitialOffset initialOffset = InitialOffset.NEWEST;

    private boolean validateMagicByte = false;

    private Duration pollDuration = Duration.ofMillis(100);

    private Duration selectTimeout = Duration.ofMillis(100);

    private Duration commitInterval = Duration.ofSeconds(1);

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration closeTimeout = Duration.ofSeconds(30);

    private Integer channelBufferSize = 256;

    private String clientId;

    private Duration registryRequestTimeout = Duration.ofSeconds(10);

    private String registryUsername;

    private String registryPassword;

    private Properties consumerProperties = new Properties();

    /**
     * Returns errors and rebalance notifications and reads partitions without a committed offset from the beginning.
     */
    public static AvroConsumerConfig defaultConfig() {
        AvroConsumerConfig config = new AvroConsumerConfig();
        config.setReturnErrors(true);
        config.setReturnNotifications(true);
        config.setInitialOffset(InitialOffset.OLDEST);
        return config;
    }

    public boolean isReturnErrors() {
        return returnErrors;
    }

    public void setReturnErrors(boolean returnErrors) {
        this.returnErrors = returnErrors;
    }

    public boolean isReturnNotifications() {
        return returnNotifications;
    }

    public void setReturnNotifications(boolean returnNotifications) {
        this.returnNotifications = returnNotifications;
    }

    public InitialOffset getInitialOffset() {
        return initialOffset;
    }

    public void setInitialOffset(InitialOffset initialOffset) {
        this.initialOffset = initialOffset;
    }

    public boolean isValidateMagicByte() {
        return validateMagicByte;
    }

    /**
     * When enabled, records whose first byte is not {@code 0} fail to decode instead of being read anyway.
     */
    public void setValidateMagicByte(boolean validateMagicByte) {
        this.validateMagicByte = validateMagicByte;
    }

    public Duration getPollDuration() {
        return pollDuration;
    }

    public void setPollDuration(Duration pollDuration) {
        this.pollDuration = pollDuration;
    }

    public Duration getSelectTimeout() {
        return selectTimeout;
    }

    /**
     * Longest time the event loop waits for a record before checking for shutdown again.
     */
    public void setSelectTimeout(Duration selectTimeout) {
        this.selectTimeout = selectTimeout;
    }

    public Duration getCommitInterval() {
        return commitInterval;
    }

    public void setCommitInterval(Duration commitInterval) {
        this.commitInterval = commitInterval;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getCloseTimeout() {
        return closeTimeout;
    }

    public void setCloseTimeout(Duration closeTimeout) {
        this.closeTimeout = closeTimeout;
    }

    public Integer getChannelBufferSize() {
        return channelBufferSize;
    }

    public void setChannelBufferSize(Integer channelBufferSize) {
        this.channelBufferSize = channelBufferSize;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public Duration getRegistryRequestTimeout() {
        return registryRequestTimeout;
    }

    public void setRegistryRequestTimeout(Duration registryRequestTimeout) {
        this.registryRequestTimeout = registryRequestTimeout;
    }

    public String getRegistryUsername() {
        return registryUsername;
    }

    public String getRegistryPassword() {
        return registryPassword;
    }

    public void setRegistryCredentials(String username, String password) {
        this.registryUsername = username;
        this.registryPassword = password;
    }

    public Properties getConsumerProperties() {
        return consumerProperties;
    }

    /**
     * Extra Kafka consumer settings (security, fetch sizes...). Deserializers, group id and auto commit are
     * always set by the consumer itself.
     */
    public void setConsumerProperties(Properties consumerProperties) {
        this.consumerProperties = consumerProperties;
    }
}
