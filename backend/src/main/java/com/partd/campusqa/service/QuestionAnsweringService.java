package com.partd.campusqa.service;

import com.partd.campusqa.model.AnswerResult;
import com.partd.campusqa.model.EvaluationResult;
import com.partd.campusqa.model.ProcessorOutput;
import com.partd.campusqa.model.QaResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Runs a question through understanding, answer synthesis and evaluation.
 */
@Service
@Slf4j
public class QuestionAnsweringService {

    private final QuestionProcessor processor;
    private final AnswerSynthesizer synthesizer;
    private final AnswerEvaluator evaluator;

    public QuestionAnsweringService(QuestionProcessor processor,
                                    AnswerSynthesizer synthesizer,
                                    AnswerEvaluator evaluator) {
        this.processor = processor;
        this.synthesizer = synthesizer;
        this.evaluator = evaluator;
    }

    public ProcessorOutput process(String question) {
        return processor.process(question);
    }

    public AnswerResult answer(ProcessorOutput processed) {
        return synthesizer.answer(processed);
    }

    public QaResponse ask(String question) {
        long start = System.currentTimeMillis();
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        log.info("🔵 [REQUEST-{}] Question received: '{}'", requestId, question);

        // Step 1: understanding
        ProcessorOutput processed = processor.process(question);
        log.info("   [REQUEST-{}] intent={}, domain={}, retrieval_query='{}'",
                requestId, processed.getIntent(), processed.getDomain(), processed.getRetrievalQuery());

        // Step 2: answer
        AnswerResult answer = synthesizer.answer(processed);
        log.info("   [REQUEST-{}] answer state={}, confidence={}, sources={}",
                requestId, answer.getDebug() == null ? null : answer.getDebug().get("state"),
                answer.getConfidence(), answer.getSources() == null ? 0 : answer.getSources().size());

        // Step 3: evaluation
        EvaluationResult evaluation = evaluator.evaluate(question, processed, answer);

        long duration = System.currentTimeMillis() - start;
        log.info("✅ [REQUEST-{}] Completed in {}ms (score: {}, passed: {})",
                requestId, duration, evaluation.getOverallScore(), evaluation.isPassed());

        return QaResponse.builder()
                .requestId(requestId)
                .question(question)
                .processed(processed)
                .answer(answer)
                .evaluation(evaluation)
                .processingTimeMs(duration)
                .build();
    }
}
