package com.formulagraph.app.services;

import com.formulagraph.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Builds the advisory integration index by keyword matching over text cells.
 *
 * <p>A text cell whose text contains a parameter phrase is a label. The nearest cell to its
 * right holding a number or a formula is the candidate value (NEIGHBOR_VALUE); a label with
 * no such neighbor is kept as LABEL_ONLY. Only parameters found in more than one location
 * become integration points.
 */
@Service
public class IntegrationIndexService {

    private static final Logger logger = LoggerFactory.getLogger(IntegrationIndexService.class);

    public IntegrationIndex buildIndex(Collection<Workbook> workbooks) {
        Map<IntegrationParameter, List<ParameterMatch>> found = new EnumMap<>(IntegrationParameter.class);
        for (Workbook workbook : workbooks) {
            for (ParameterMatch match : scan(workbook)) {
                found.computeIfAbsent(match.getParameter(), k -> new ArrayList<>()).add(match);
            }
        }

        Map<IntegrationParameter, List<ParameterMatch>> points = new EnumMap<>(IntegrationParameter.class);
        for (Map.Entry<IntegrationParameter, List<ParameterMatch>> entry : found.entrySet()) {
            if (entry.getValue().size() > 1) {
                points.put(entry.getKey(), entry.getValue());
            } else {
                logger.debug("Parameter {} found only at {}", entry.getKey(), entry.getValue().get(0).getAddress());
            }
        }
        logger.info("Integration index over {} documents: {} integration points", workbooks.size(), points.size());
        return new IntegrationIndex(points);
    }

    /**
     * Every parameter label of one document, in loader order.
     */
    public List<ParameterMatch> scan(Workbook workbook) {
        List<ParameterMatch> matches = new ArrayList<>();
        for (Sheet sheet : workbook.getSheets()) {
            for (Cell cell : sheet.getCells()) {
                if (!cell.isText()) {
                    continue;
                }
                String text = (String) cell.getValue();
                for (IntegrationParameter parameter : IntegrationParameter.values()) {
                    if (parameter.matches(text)) {
                        matches.add(match(workbook.getDocumentId(), sheet, cell, parameter, text));
                    }
                }
            }
        }
        return matches;
    }

    private ParameterMatch match(String documentId, Sheet sheet, Cell label, IntegrationParameter parameter, String text) {
        QualifiedAddress labelAddress = label.getQualifiedAddress().withDocument(documentId);
        for (Cell neighbor : sheet.cellsRightOf(label.getAddress())) {
            if (neighbor.isFormula() || neighbor.getValue() instanceof Number) {
                return new ParameterMatch(parameter, neighbor.getQualifiedAddress().withDocument(documentId),
                        labelAddress, text, ParameterMatch.Kind.NEIGHBOR_VALUE);
            }
        }
        return new ParameterMatch(parameter, labelAddress, labelAddress, text, ParameterMatch.Kind.LABEL_ONLY);
    }
}
