package com.flowcheck.cli;

import com.flowcheck.core.WireFormat;
import com.flowcheck.core.model.ValidationResponse;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Validates connections given as a JSON array.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # connections.json:
 * # [{"source": "fetch", "output": "result", "target": "process", "input": "data"}]
 * flowcheck connections connections.json
 * }</pre>
 */
@Command(
    name = "connections",
    description = "Validate a JSON array of {source, output, target, input} connections",
    mixinStandardHelpOptions = true
)
public class ConnectionsCommand extends AbstractFlowCheckCommand {

    @Parameters(index = "0", description = "JSON file with the connection array")
    private Path connectionsFile;

    @Override
    protected int execute() throws IOException {
        List<Map<String, Object>> connections = WireFormat.readConnections(readFile(connectionsFile));
        log.debug("Read {} connections", connections.size());
        ValidationResponse response = createValidator().validateConnections(connections);
        return report(response);
    }
}
