package com.minichat.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {

    @NotBlank(message = "Missing content field")
    @Size(max = 10_000, message = "Message content exceeds 10000 characters")
    private String content;

    /** 为空表示房间消息。 */
    @JsonProperty("to_username")
    private String toUsername;
}
