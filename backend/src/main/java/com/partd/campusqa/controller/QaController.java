package com.partd.campusqa.controller;

import com.partd.campusqa.client.IntentClassifier;
import com.partd.campusqa.model.AnswerResult;
import com.partd.campusqa.model.AskRequest;
import com.partd.campusqa.model.NluContext;
import com.partd.campusqa.model.ProcessorOutput;
import com.partd.campusqa.model.QaResponse;
import com.partd.campusqa.service.QuestionAnsweringService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/qa")
@CrossOrigin(origins = "*")
@Slf4j
public class QaController {

    private final QuestionAnsweringService qaService;
    private final NluContext nluContext;
    private final IntentClassifier intentClassifier;

    public QaController(QuestionAnsweringService qaService,
                        NluContext nluContext,
                        IntentClassifier intentClassifier) {
        this.qaService = qaService;
        this.nluContext = nluContext;
        this.intentClassifier = intentClassifier;
    }

    /**
     * Question understanding only: intent, domain, slots and retrieval query.
     */
    @PostMapping("/process")
    public ResponseEntity<?> process(@Valid @RequestBody AskRequest request) {
        try {
            return ResponseEntity.ok(qaService.process(request.getQuestion()));
        } catch (Exception e) {
            log.error("❌ Error processing question '{}': {}", request.getQuestion(), e.getMessage(), e);
            return ResponseEntity.status(500).body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Answer synthesis for the exact output of /qa/process.
     */
    @PostMapping("/answer")
    public ResponseEntity<?> answer(@RequestBody ProcessorOutput processed) {
        try {
            AnswerResult answer = qaService.answer(processed);
            return ResponseEntity.ok(answer);
        } catch (Exception e) {
            log.error("❌ Error answering '{}': {}", processed.getCleanText(), e.getMessage(), e);
            return ResponseEntity.status(500).body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Full pipeline: process, answer and evaluate.
     */
    @PostMapping("/ask")
    public ResponseEntity<?> ask(@Valid @RequestBody AskRequest request) {
        try {
            QaResponse response = qaService.ask(request.getQuestion());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            log.error("❌ Error handling question '{}': {}", request.getQuestion(), e.getMessage(), e);
            return ResponseEntity.status(500).body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("intent_rules", nluContext.getIntentRules().size());
        status.put("known_intents", nluContext.getKnownIntents());
        status.put("gazetteer_slot_types", nluContext.getGazetteer().slotTypes());
        status.put("classifier", intentClassifier.name());
        return ResponseEntity.ok(status);
    }
}
