package com.cardiacreport.service.calculation;

import com.cardiacreport.model.metrics.QtcResult;
import com.cardiacreport.util.ReportFormat;
import org.springframework.stereotype.Service;

/**
 * Heart-rate correction of the QT interval.
 */
@Service
public class QtCorrectionService {

    /**
     * Bazett (QT / √RR) and Fridericia (QT / ∛RR) with RR = 60 / rate, one decimal.
     * When QT or rate is missing the device-reported QTc is used for both.
     */
    public QtcResult correct(Double qtMs, Double rateBpm, Double reportedQtc) {
        if (qtMs != null && rateBpm != null && rateBpm > 0) {
            double rr = 60.0 / rateBpm;
            return new QtcResult(
                ReportFormat.round(qtMs / Math.sqrt(rr), 1),
                ReportFormat.round(qtMs / Math.cbrt(rr), 1));
        }
        Double reported = ReportFormat.round(reportedQtc, 1);
        if (reported != null) {
            return new QtcResult(reported, reported);
        }
        return QtcResult.none();
    }
}
