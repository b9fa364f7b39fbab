package com.bayesenum.server.controller;

import com.bayesenum.server.ai.BayesNetworkException;
import com.bayesenum.server.ai.CptLookupException;
import com.bayesenum.server.ai.DegenerateEvidenceException;
import com.bayesenum.server.ai.InferenceCancelledException;
import com.bayesenum.server.ai.NetworkFormatException;
import com.bayesenum.server.ai.ProbabilityException;
import com.bayesenum.server.ai.StructuralException;
import com.bayesenum.server.ai.UnknownVariableException;
import com.bayesenum.server.ai.format.NetworkFormatter;
import com.bayesenum.server.ai.inference.InferenceResult;
import com.bayesenum.server.ai.network.BayesianNetwork;
import com.bayesenum.server.ai.network.Node;
import com.bayesenum.server.service.NetworkNotLoadedException;
import com.bayesenum.server.service.NetworkService;
import com.bayesenum.server.service.QueryOutcome;
import com.bayesenum.server.util.DataPathResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class QueryController {

    private static final Logger logger = LoggerFactory.getLogger(QueryController.class);
    private final NetworkService networkService;

    public QueryController(NetworkService networkService) {
        this.networkService = networkService;
    }

    public static class LoadRequest {
        public String structureFile;
        public String cptFile;
    }

    public static class QueryRequest {
        public String query;
        public Map<String, String> evidence;
        public boolean trace;
    }

    public static class NodeView {
        public String name;
        public List<String> values;
        public List<String> parents;
        public List<String> children;
    }

    public static class QueryResponse {
        public String query;
        public Map<String, String> evidence;
        public Map<String, Double> distribution;
        public String mostLikelyValue;
        public double mostLikelyProbability;
        public List<String> trace;
        public boolean traceTruncated;
    }

    @GetMapping("/network")
    public Map<String, Object> structure() {
        BayesianNetwork network = networkService.getNetwork();
        List<NodeView> nodes = new ArrayList<>();
        for (String name : network.topologicalOrder()) {
            Node node = network.getNode(name);
            NodeView view = new NodeView();
            view.name = name;
            view.values = node.getValues();
            view.parents = node.getParents();
            view.children = network.children(name);
            nodes.add(view);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("roots", network.roots());
        body.put("topologicalOrder", network.topologicalOrder());
        body.put("nodes", nodes);
        return body;
    }

    @GetMapping(value = "/network/cpts", produces = MediaType.TEXT_PLAIN_VALUE)
    public String cpts() {
        return NetworkFormatter.cpts(networkService.getNetwork());
    }

    @PostMapping("/network/load")
    public ResponseEntity<?> load(@RequestBody LoadRequest request) {
        if (request.structureFile == null || request.cptFile == null) {
            return ResponseEntity.badRequest().body(error("structureFile and cptFile are required"));
        }
        if (!DataPathResolver.isInsideDataDirectory(request.structureFile)
                || !DataPathResolver.isInsideDataDirectory(request.cptFile)) {
            logger.warn("Refused load outside the data directory: {}, {}", request.structureFile, request.cptFile);
            return ResponseEntity.badRequest()
                    .body(error("Network files must be classpath: resources or lie inside the data directory"));
        }
        BayesianNetwork network = networkService.load(request.structureFile, request.cptFile);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("nodes", network.size());
        body.put("roots", network.roots());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/query")
    public ResponseEntity<?> query(@RequestBody QueryRequest request) {
        if (request.query == null || request.query.isBlank()) {
            return ResponseEntity.badRequest().body(error("query is required"));
        }
        logger.info("Received query for {} given {}", request.query, request.evidence);

        QueryOutcome outcome = networkService.query(request.query, request.evidence, request.trace);
        InferenceResult result = outcome.getResult();

        QueryResponse response = new QueryResponse();
        response.query = result.getQueryVariable();
        response.evidence = result.getEvidence();
        response.distribution = result.getDistribution();
        response.mostLikelyValue = result.getMostLikelyValue();
        response.mostLikelyProbability = result.getMostLikelyProbability();
        response.trace = outcome.getTrace();
        response.traceTruncated = outcome.isTraceTruncated();
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(NetworkNotLoadedException.class)
    public ResponseEntity<Map<String, String>> notLoaded(NetworkNotLoadedException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error(e.getMessage()));
    }

    // The offending line stays in the log; clients only learn its number.
    @ExceptionHandler(NetworkFormatException.class)
    public ResponseEntity<Map<String, String>> badFormat(NetworkFormatException e) {
        logger.info("Rejected network file: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getReason() + " (line " + e.getLineNumber() + ")"));
    }

    @ExceptionHandler({ UnknownVariableException.class, CptLookupException.class,
            DegenerateEvidenceException.class })
    public ResponseEntity<Map<String, String>> badInput(BayesNetworkException e) {
        logger.info("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    @ExceptionHandler({ StructuralException.class, ProbabilityException.class })
    public ResponseEntity<Map<String, String>> invalidNetwork(BayesNetworkException e) {
        logger.warn("Network rejected: {}", e.getMessage());
        return ResponseEntity.unprocessableEntity().body(error(e.getMessage()));
    }

    @ExceptionHandler(InferenceCancelledException.class)
    public ResponseEntity<Map<String, String>> cancelled(InferenceCancelledException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error(e.getMessage()));
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, String>> unreadable(UncheckedIOException e) {
        logger.warn("Failed to read network files", e);
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    private static Map<String, String> error(String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }
}
