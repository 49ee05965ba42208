package com.fitplan.backend.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * paired_sets 的一筆宣告；兩欄都允許 null，
 * 格式不對的宣告照存，交給 PairingResolver 略過。
 */
@Data
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class PairedSet {

    @Column(name = "first_exercise_id")
    private Long first;

    @Column(name = "second_exercise_id")
    private Long second;
}
