package com.flagship.member_payments.invoice;

import com.flagship.member_payments.payment.CurrencyCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AmountInWordsTest {

    @Test
    @DisplayName("Lakh and thousand groups")
    void lakhs() {
        assertEquals("Two Lakh Fifty Thousand Rupees Only", AmountInWords.of(25000000, CurrencyCode.INR));
    }

    @Test
    @DisplayName("Crore amounts")
    void crores() {
        assertEquals("One Crore Rupees Only", AmountInWords.of(1000000000, CurrencyCode.INR));
        assertEquals("Twelve Crore Thirty Four Lakh Fifty Six Thousand Seven Hundred Eighty Nine Rupees Only",
            AmountInWords.of(12345678900L, CurrencyCode.INR));
    }

    @Test
    @DisplayName("Paise are spelled after the rupees")
    void paise() {
        assertEquals("One Hundred Twenty Three Rupees and Forty Five Paise Only",
            AmountInWords.of(12345, CurrencyCode.INR));
        assertEquals("Five Paise Only", AmountInWords.of(5, CurrencyCode.INR));
    }

    @Test
    @DisplayName("Teens, zero and other currencies")
    void edges() {
        assertEquals("Nineteen Rupees Only", AmountInWords.of(1900, CurrencyCode.INR));
        assertEquals("Zero Rupees Only", AmountInWords.of(0, CurrencyCode.INR));
        assertEquals("Ten USD and Fifty Cents Only", AmountInWords.of(1050, CurrencyCode.USD));
        assertThrows(IllegalArgumentException.class, () -> AmountInWords.of(-1, CurrencyCode.INR));
    }
}
