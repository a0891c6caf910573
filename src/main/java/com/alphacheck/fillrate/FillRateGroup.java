package com.alphacheck.fillrate;

import lombok.Value;

/** Mean fill rate of one ticker (by-time view) or one arrival bucket (by-ticker view). */
@Value
public class FillRateGroup {

    String key;
    double meanFillRate;
    int trades;
}
