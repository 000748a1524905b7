package fr.imt.jobdaemon.jobdaemon.presentation.ipc.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IpcRequest {

    /**
     * Chosen by the caller and echoed in the response.
     */
    private String id;

    private String command;

    private JsonNode args;
}
