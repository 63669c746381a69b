package com.example.striprequest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public class StripSubmissionRequest {

    @NotBlank
    @JsonProperty("host")
    private String host;

    @NotNull
    @Min(1)
    @Max(65535)
    @JsonProperty("port")
    private Integer port;

    /** Defaults to TLS when omitted. */
    @JsonProperty("tls")
    private Boolean tls;

    @NotBlank
    @JsonProperty("request")
    private String request;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public Integer getPort() {
        return port;
    }

    public void setPort(Integer port) {
        this.port = port;
    }

    public Boolean getTls() {
        return tls;
    }

    public void setTls(Boolean tls) {
        this.tls = tls;
    }

    public String getRequest() {
        return request;
    }

    public void setRequest(String request) {
        this.request = request;
    }
}
