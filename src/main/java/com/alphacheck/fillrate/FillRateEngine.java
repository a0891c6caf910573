package com.alphacheck.fillrate;

import com.alphacheck.checker.CheckerSettings;
import com.alphacheck.domain.TradeIntentJoiner;
import com.alphacheck.domain.model.ValidationDataset;
import com.alphacheck.domain.vo.TradeIntent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the per-trade fill table: for every pair of consecutive split-target buckets, the
 * realized position change divided by the intended trade. Snapshots taken between two
 * target buckets are not used.
 */
@Component
public class FillRateEngine {

    private static final Logger log = LoggerFactory.getLogger(FillRateEngine.class);

    private final CheckerSettings settings;

    public FillRateEngine(CheckerSettings settings) {
        this.settings = settings;
    }

    public FillTable computeFills(ValidationDataset dataset) {
        List<FillRecord> records =
                TradeIntentJoiner.joinOnTargetTimes(dataset).stream().map(this::toRecord).toList();
        long analyzable = records.stream().filter(FillRecord::isAnalyzable).count();
        log.debug("Fill table built: {} trades, {} analyzable", records.size(), analyzable);
        return new FillTable(records);
    }

    public double fillRate(double intendedTrade, double actualTrade) {
        if (Math.abs(intendedTrade) <= settings.getTolerance()) {
            return Double.NaN;
        }
        return actualTrade / intendedTrade;
    }

    private FillRecord toRecord(TradeIntent intent) {
        return FillRecord.builder()
                .participantId(intent.getParticipantId())
                .ticker(intent.getTicker())
                .timeFrom(intent.getTimeFrom())
                .timeTo(intent.getTimeTo())
                .targetVolume(intent.getTargetVolume())
                .currentPosition(intent.getCurrentPosition())
                .nextPosition(intent.getNextPosition())
                .intendedTrade(intent.getIntendedTrade())
                .actualTrade(intent.getActualTrade())
                .fillRate(fillRate(intent.getIntendedTrade(), intent.getActualTrade()))
                .build();
    }
}
