package com.proofsmith.core.retrieval;

import java.util.LinkedHashMap;
import java.util.Map;

/** Seed corpus written to an empty documents directory. */
final class DefaultDocuments {

    private DefaultDocuments() {}

    static Map<String, String> all() {
        Map<String, String> docs = new LinkedHashMap<>();
        docs.put("default_tactics.txt", """
                Lean 4 Basic Tactics:
                - `rfl`: reflexivity, proves `a = a`
                - `simp`: simplification using simp lemmas
                - `norm_num`: normalize numerical expressions
                - `ring`: prove ring equations
                - `omega`: arithmetic over natural numbers and integers
                - `sorry`: placeholder (should not be used in final proofs)

                Example:
                theorem add_comm (a b : Nat) : a + b = b + a := by
                  ring
                """);
        docs.put("default_functions.txt", """
                Lean 4 Function Definitions:
                - Use `def` for definitions
                - Specify types explicitly
                - Use pattern matching with `match`

                Example:
                def factorial (n : Nat) : Nat :=
                  match n with
                  | 0 => 1
                  | n + 1 => (n + 1) * factorial n

                def max (a b : Int) : Int :=
                  if a >= b then a else b
                """);
        docs.put("default_proofs.txt", """
                Lean 4 Proof Tactics:
                - `intro`: introduce hypotheses
                - `apply`: apply a theorem
                - `exact`: provide exact proof term
                - `rw`: rewrite using equation
                - `split`: case analysis
                - `contradiction`: prove false from contradictory hypotheses
                - `unfold`: unfold definitions

                Example:
                theorem modus_ponens (P Q : Prop) (hpq : P → Q) (hp : P) : Q := by
                  apply hpq
                  exact hp
                """);
        return docs;
    }
}
