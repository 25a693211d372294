package com.cybergrader.modules.lab;

import com.cybergrader.exception.BusinessException;
import com.cybergrader.exception.ResourceNotFoundException;
import com.cybergrader.modules.content.FlagDefinition;
import com.cybergrader.modules.content.LabDefinition;
import com.cybergrader.modules.lab.dto.FlagSubmissionRequest;
import com.cybergrader.modules.store.FlagSubmissionResult;
import com.cybergrader.modules.store.GradingStore;
import com.cybergrader.modules.store.LabStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LabService {

    private final GradingStore store;

    public List<LabStatus> labsForUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new BusinessException("user_id is required");
        }
        return store.labStatusForUser(userId);
    }

    public FlagSubmissionResult submitFlag(String labId, String flagName, FlagSubmissionRequest request) {
        LabDefinition lab = store.findLab(labId)
                .orElseThrow(() -> new ResourceNotFoundException("Lab", labId));
        FlagDefinition flag = lab.findFlag(flagName)
                .orElseThrow(() -> new ResourceNotFoundException("Flag", flagName));

        FlagSubmissionResult result = store.recordFlagSubmission(labId, flag, request.getUserId(),
                request.getSubmission());
        log.info("Flag {}/{} submitted by {}: {}", labId, flagName, request.getUserId(),
                result.correct() ? "correct" : "incorrect");
        return result;
    }
}
