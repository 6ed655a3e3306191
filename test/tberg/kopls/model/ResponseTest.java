package tberg.kopls.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import tberg.kopls.InputValidationException;

public class ResponseTest {

	@Test
	public void labelsAreDummyCoded() {
		Response r = Response.labels("ctrl", "case", "ctrl", "case", "case");
		assertThat(r.getClassNames()).containsExactly("case", "ctrl");
		assertThat(r.getClassIndex()).containsExactly(1, 0, 1, 0, 0);
		assertThat(r.getValues()[0]).containsExactly(0.0, 1.0);
		assertThat(r.classCounts()).containsExactly(3, 2);
	}

	@Test
	public void numericLabelsSortNumerically() {
		Response r = Response.labels(10, 2, 2, 10, 3);
		assertThat(r.getClassNames()).containsExactly("2", "3", "10");
	}

	@Test
	public void numericColumnBecomesLabelsForDiscriminant() {
		Response r = Response.numeric(new double[] {1, 0, 1, 0}).encode(ModelType.DISCRIMINANT);
		assertThat(r.isCategorical()).isTrue();
		assertThat(r.getClassNames()).containsExactly("0", "1");
		assertThat(r.numColumns()).isEqualTo(2);

		Response dummy = Response.numeric(new double[][] {{1, 0, 0}, {0, 0, 1}, {0, 1, 0}}).encode(ModelType.DISCRIMINANT);
		assertThat(dummy.getClassNames()).containsExactly("1", "2", "3");
		assertThat(dummy.getClassIndex()).containsExactly(0, 2, 1);
	}

	@Test
	public void labelsCannotRegress() {
		assertThatThrownBy(() -> Response.labels("a", "b").encode(ModelType.REGRESSION)).isInstanceOf(InputValidationException.class);
		assertThat(Response.numeric(new double[] {1.5, 2.5}).encode(ModelType.REGRESSION).isCategorical()).isFalse();
	}

	@Test
	public void permuteMovesRows() {
		Response r = Response.labels("a", "b", "c").permute(new int[] {2, 0, 1});
		assertThat(r.getLabels()).containsExactly("c", "a", "b");
		assertThat(r.getClassIndex()).containsExactly(2, 0, 1);
		assertThat(r.getClassNames()).containsExactly("a", "b", "c");
	}

	@Test
	public void invalidInput() {
		assertThatThrownBy(() -> Response.numeric(new double[] {1, Double.NaN})).isInstanceOf(InputValidationException.class);
		assertThatThrownBy(() -> Response.numeric(new double[][] {{1, 2}, {3}})).isInstanceOf(InputValidationException.class);
		assertThatThrownBy(() -> Response.labels(new String[0])).isInstanceOf(InputValidationException.class);
		assertThatThrownBy(() -> new DataBlock("x", new double[][] {{1, Double.POSITIVE_INFINITY}})).isInstanceOf(InputValidationException.class);
		assertThatThrownBy(() -> new DataBlock("x", new double[][] {{1, 2}}, new String[] {"v1"}, null)).isInstanceOf(InputValidationException.class);
	}

}
