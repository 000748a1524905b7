package fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IpcResponse {

    private String id;

    private boolean success;

    private Object data;

    private String error;

    private String code;

    public static IpcResponse ok(String id, Object data) {
        return IpcResponse.builder().id(id).success(true).data(data).build();
    }

    public static IpcResponse error(String id, String code, String message) {
        return IpcResponse.builder().id(id).success(false).code(code).error(message).build();
    }
}
