package com.dcruver.kepwaretags.export;

import com.dcruver.kepwaretags.domain.TagDataType;

import java.util.Locale;

/**
 * Hands out device addresses in request order, one counter per data type.
 *
 * <ul>
 *   <li>String: {@code S001}, {@code S002}, ...</li>
 *   <li>Integer: {@code D0000}, {@code D0001}, ...</li>
 *   <li>Boolean: {@code D0000.0} ... {@code D0000.15}, then {@code D0001.0}: 16 bits per word</li>
 * </ul>
 *
 * Integer and Boolean counters are independent even though both use the D prefix.
 * Digits are always ASCII, whatever the default locale.
 * Not reusable: create one per export.
 */
public class AddressAllocator {

    static final int BITS_PER_WORD = 16;

    private int stringIndex = 1;
    private int integerIndex = 0;
    private int booleanWord = 0;
    private int booleanBit = 0;

    public String next(TagDataType dataType) {
        return switch (dataType) {
            case STRING -> String.format(Locale.ROOT, "S%03d", stringIndex++);
            case INTEGER -> String.format(Locale.ROOT, "D%04d", integerIndex++);
            case BOOLEAN -> nextBoolean();
        };
    }

    private String nextBoolean() {
        String address = String.format(Locale.ROOT, "D%04d.%d", booleanWord, booleanBit);
        booleanBit++;
        if (booleanBit >= BITS_PER_WORD) {
            booleanBit = 0;
            booleanWord++;
        }
        return address;
    }
}
