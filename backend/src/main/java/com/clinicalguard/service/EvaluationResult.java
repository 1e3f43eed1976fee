package com.clinicalguard.service;

import com.clinicalguard.signal.DecisionSignal;
import com.clinicalguard.signal.SignalSummary;
import com.clinicalguard.validation.DiagnosisValidation;
import com.clinicalguard.validation.PrescriptionValidation;

import lombok.Value;

/**
 * Signal plus the identification details behind it. {@code prescription} and
 * {@code diagnosis} are null when the request carried no such field.
 * {@code rulesEvaluated} counts the compiled rules of the snapshot used, fired or not.
 */
@Value
public class EvaluationResult {
    DecisionSignal signal;
    SignalSummary summary;
    PrescriptionValidation prescription;
    DiagnosisValidation diagnosis;
    long snapshotGeneration;
    int rulesEvaluated;
}
